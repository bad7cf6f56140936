package com.phillippitts.callagent.service.session;

import com.phillippitts.callagent.config.properties.ProfileProperties;
import com.phillippitts.callagent.domain.ClientProfile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ClientProfileStore} backed by {@code call.profiles.*} configuration.
 *
 * <p>Numbers are compared after removing spaces, dashes and parentheses, so
 * {@code +61 3 9000 0000} and {@code +61390000000} select the same profile.
 */
public class PropertiesClientProfileStore implements ClientProfileStore {

    private static final Logger LOG = LogManager.getLogger(PropertiesClientProfileStore.class);

    private final Map<String, ClientProfile> byNumber;

    public PropertiesClientProfileStore(ProfileProperties properties) {
        Map<String, ClientProfile> profiles = new LinkedHashMap<>();
        for (ProfileProperties.Client client : properties.getClients()) {
            ClientProfile profile = client.toProfile();
            ClientProfile previous = profiles.put(normalize(client.getPhoneNumber()), profile);
            if (previous != null) {
                LOG.warn("Number {} configured for both {} and {}; using {}",
                        client.getPhoneNumber(), previous.clientId(), profile.clientId(), profile.clientId());
            }
        }
        this.byNumber = Collections.unmodifiableMap(profiles);
        LOG.info("Loaded {} client profiles", byNumber.size());
    }

    @Override
    public Optional<ClientProfile> find(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byNumber.get(normalize(phoneNumber)));
    }

    @Override
    public Collection<ClientProfile> all() {
        return byNumber.values();
    }

    static String normalize(String phoneNumber) {
        return phoneNumber == null ? "" : phoneNumber.replaceAll("[\\s\\-()]", "");
    }
}
