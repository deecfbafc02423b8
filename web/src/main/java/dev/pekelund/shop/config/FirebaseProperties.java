package dev.pekelund.shop.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "firebase")
public class FirebaseProperties {

    /**
     * Flag indicating whether Firebase ID tokens are accepted as API credentials.
     */
    private boolean enabled;

    /**
     * Path or resource descriptor to the Firebase service account credentials file.
     */
    private String credentials;

    /**
     * Firebase project the ID tokens are issued for. Optional when the credentials name it.
     */
    private String projectId;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getCredentials() {
        return credentials;
    }

    public void setCredentials(String credentials) {
        this.credentials = credentials;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }
}
