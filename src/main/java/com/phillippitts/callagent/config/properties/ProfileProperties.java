package com.phillippitts.callagent.config.properties;

import com.phillippitts.callagent.domain.ClientProfile;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Client profiles keyed by the business phone number they answer.
 *
 * <p>Example:
 * <pre>
 * call.profiles.clients[0].phone-number=+61390000000
 * call.profiles.clients[0].client-id=jameson_plumbing
 * call.profiles.clients[0].business-name=Jameson Plumbing
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "call.profiles")
public class ProfileProperties {

    @Valid
    private List<Client> clients = new ArrayList<>();

    public List<Client> getClients() {
        return clients;
    }

    public void setClients(List<Client> clients) {
        this.clients = clients;
    }

    /**
     * One configured client. Unset fields inherit from the default profile, except the website
     * and greeting, which stay empty.
     */
    public static class Client {
        @NotBlank
        private String phoneNumber;
        @NotBlank
        private String clientId;
        private String businessName;
        private String assistantName;
        private String industry;
        private String location;
        private String city;
        private String businessHours;
        private String serviceArea;
        private String website;
        private Boolean emergencyAvailable;
        private String currency;
        private String timezone;
        private String voiceId;
        private String greetingSnippet;
        private String persona;
        private List<String> flags = new ArrayList<>();

        /**
         * Builds the immutable profile, filling gaps from {@link ClientProfile#defaultProfile()}.
         */
        public ClientProfile toProfile() {
            ClientProfile base = ClientProfile.defaultProfile();
            return new ClientProfile(
                    clientId,
                    orElse(businessName, base.businessName()),
                    orElse(assistantName, base.assistantName()),
                    orElse(industry, base.industry()),
                    orElse(location, base.location()),
                    orElse(city, base.city()),
                    orElse(businessHours, base.businessHours()),
                    orElse(serviceArea, base.serviceArea()),
                    phoneNumber,
                    website,
                    emergencyAvailable == null ? base.emergencyAvailable() : emergencyAvailable,
                    orElse(currency, base.currency()),
                    orElse(timezone, base.timezone()),
                    orElse(voiceId, base.voiceId()),
                    greetingSnippet,
                    persona,
                    (flags == null || flags.isEmpty()) ? base.flagTemplate() : flags);
        }

        private static String orElse(String value, String fallback) {
            return (value == null || value.isBlank()) ? fallback : value;
        }

        public String getPhoneNumber() { return phoneNumber; }
        public void setPhoneNumber(String phoneNumber) { this.phoneNumber = phoneNumber; }
        public String getClientId() { return clientId; }
        public void setClientId(String clientId) { this.clientId = clientId; }
        public String getBusinessName() { return businessName; }
        public void setBusinessName(String businessName) { this.businessName = businessName; }
        public String getAssistantName() { return assistantName; }
        public void setAssistantName(String assistantName) { this.assistantName = assistantName; }
        public String getIndustry() { return industry; }
        public void setIndustry(String industry) { this.industry = industry; }
        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
        public String getCity() { return city; }
        public void setCity(String city) { this.city = city; }
        public String getBusinessHours() { return businessHours; }
        public void setBusinessHours(String businessHours) { this.businessHours = businessHours; }
        public String getServiceArea() { return serviceArea; }
        public void setServiceArea(String serviceArea) { this.serviceArea = serviceArea; }
        public String getWebsite() { return website; }
        public void setWebsite(String website) { this.website = website; }
        public Boolean getEmergencyAvailable() { return emergencyAvailable; }
        public void setEmergencyAvailable(Boolean emergencyAvailable) { this.emergencyAvailable = emergencyAvailable; }
        public String getCurrency() { return currency; }
        public void setCurrency(String currency) { this.currency = currency; }
        public String getTimezone() { return timezone; }
        public void setTimezone(String timezone) { this.timezone = timezone; }
        public String getVoiceId() { return voiceId; }
        public void setVoiceId(String voiceId) { this.voiceId = voiceId; }
        public String getGreetingSnippet() { return greetingSnippet; }
        public void setGreetingSnippet(String greetingSnippet) { this.greetingSnippet = greetingSnippet; }
        public String getPersona() { return persona; }
        public void setPersona(String persona) { this.persona = persona; }
        public List<String> getFlags() { return flags; }
        public void setFlags(List<String> flags) { this.flags = flags; }
    }
}
