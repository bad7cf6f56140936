package com.phillippitts.callagent.service.session;

import com.phillippitts.callagent.domain.ClientProfile;
import com.phillippitts.callagent.exception.ProfileNotFoundException;

import java.util.Collection;
import java.util.Optional;

/**
 * Lookup of client profiles by the business number that was called.
 */
public interface ClientProfileStore {

    /**
     * Finds the profile configured for a number.
     */
    Optional<ClientProfile> find(String phoneNumber);

    /**
     * Strict lookup.
     *
     * @throws ProfileNotFoundException if no profile is configured for the number
     */
    default ClientProfile require(String phoneNumber) {
        return find(phoneNumber).orElseThrow(() -> new ProfileNotFoundException(phoneNumber));
    }

    /**
     * Lenient lookup used for new calls: falls back to {@link ClientProfile#defaultProfile()}.
     */
    default ClientProfile resolve(String phoneNumber) {
        return find(phoneNumber).orElseGet(ClientProfile::defaultProfile);
    }

    Collection<ClientProfile> all();
}
