package dev.pekelund.shop.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storefront.security")
public class StorefrontSecurityProperties {

    /**
     * Username/password accounts for HTTP Basic access when Firebase is disabled.
     */
    private List<FallbackUser> fallbackUsers = new ArrayList<>();

    public List<FallbackUser> getFallbackUsers() {
        return fallbackUsers;
    }

    public void setFallbackUsers(List<FallbackUser> fallbackUsers) {
        this.fallbackUsers = fallbackUsers != null ? fallbackUsers : new ArrayList<>();
    }

    public static class FallbackUser {

        private String username;
        private String password;
        private List<String> roles = new ArrayList<>(List.of("USER"));

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public List<String> getRoles() {
            return roles;
        }

        public void setRoles(List<String> roles) {
            this.roles = roles;
        }
    }
}
