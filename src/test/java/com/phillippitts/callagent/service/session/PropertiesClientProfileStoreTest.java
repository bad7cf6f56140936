package com.phillippitts.callagent.service.session;

import com.phillippitts.callagent.config.properties.ProfileProperties;
import com.phillippitts.callagent.domain.ClientProfile;
import com.phillippitts.callagent.exception.ProfileNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PropertiesClientProfileStoreTest {

    private PropertiesClientProfileStore store;

    @BeforeEach
    void setUp() {
        ProfileProperties.Client client = new ProfileProperties.Client();
        client.setPhoneNumber("+61 (3) 9000-0000");
        client.setClientId("jameson_plumbing");
        client.setBusinessName("Jameson Plumbing");
        client.setGreetingSnippet("jameson_intro.mp3");
        client.setEmergencyAvailable(false);
        client.setFlags(List.of("intro_played", "quote_sent"));

        ProfileProperties properties = new ProfileProperties();
        properties.setClients(List.of(client));
        store = new PropertiesClientProfileStore(properties);
    }

    @Test
    void shouldMatchNumbersIgnoringFormatting() {
        assertThat(store.find("+61390000000")).map(ClientProfile::clientId).contains("jameson_plumbing");
        assertThat(store.find("+61 3 9000 0000")).isPresent();
    }

    @Test
    void unsetFieldsShouldInheritFromDefaultProfile() {
        ClientProfile profile = store.require("+61390000000");

        assertThat(profile.assistantName()).isEqualTo(ClientProfile.defaultProfile().assistantName());
        assertThat(profile.voiceId()).isEqualTo(ClientProfile.defaultProfile().voiceId());
        assertThat(profile.greetingSnippet()).isEqualTo("jameson_intro.mp3");
        assertThat(profile.flagTemplate()).containsExactly("intro_played", "quote_sent");
    }

    @Test
    void unconfiguredNumberShouldGetDefaultProfileFields() {
        ClientProfile profile = store.resolve("+61299999999");

        assertThat(profile.clientId()).isEqualTo("default");
        assertThat(profile.businessName()).isEqualTo("Pete's Plumbing");
        assertThat(profile.assistantName()).isEqualTo("Pete");
        assertThat(profile.industry()).isEqualTo("plumbing_services");
        assertThat(profile.location()).isEqualTo("Australia");
        assertThat(profile.city()).isEqualTo("Melbourne");
        assertThat(profile.businessHours()).isEqualTo("Mon-Fri 8AM-6PM, Sat 8AM-4PM");
        assertThat(profile.serviceArea()).isEqualTo("Melbourne Metro");
        assertThat(profile.website()).isEqualTo("https://petesplumbing.com.au");
        assertThat(profile.emergencyAvailable()).isTrue();
        assertThat(profile.currency()).isEqualTo("AUD");
        assertThat(profile.timezone()).isEqualTo("Australia/Melbourne");
        assertThat(profile.voiceId()).isEqualTo("21m00Tcm4TlvDq8ikWAM");
        assertThat(profile.flagTemplate()).isEqualTo(ClientProfile.DEFAULT_FLAG_TEMPLATE);
    }

    @Test
    void configuredClientShouldKeepOwnRegionalSettings() {
        ClientProfile profile = store.require("+61390000000");

        assertThat(profile.emergencyAvailable()).isFalse();
        assertThat(profile.currency()).isEqualTo("AUD");
        assertThat(profile.timezone()).isEqualTo("Australia/Melbourne");
        assertThat(profile.website()).isNull();
    }

    @Test
    void requireShouldThrowForUnknownNumber() {
        assertThatThrownBy(() -> store.require("+61299999999"))
                .isInstanceOf(ProfileNotFoundException.class)
                .hasMessageContaining("+61299999999");
    }

    @Test
    void resolveShouldFallBackToDefaultProfile() {
        assertThat(store.resolve("+61299999999").isDefault()).isTrue();
        assertThat(store.resolve(null).isDefault()).isTrue();
    }

    @Test
    void blankNumberShouldNotMatch() {
        assertThat(store.find(" ")).isEmpty();
        assertThat(store.all()).hasSize(1);
    }
}
