package dev.pekelund.finsight.records;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "finsight.firestore")
public class FirestoreProperties {

    /**
     * Flag indicating whether Firestore integration is enabled. When disabled an in-memory store is used.
     */
    private boolean enabled;

    /**
     * Path or resource descriptor to the service account credentials file.
     */
    private String credentials;

    /**
     * Optional Google Cloud project identifier.
     */
    private String projectId;

    /**
     * Optional host:port of a Firestore emulator.
     */
    private String emulatorHost;

    /**
     * Prefix prepended to every table name to form the collection name.
     */
    private String collectionPrefix = "";

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

    public String getEmulatorHost() {
        return emulatorHost;
    }

    public void setEmulatorHost(String emulatorHost) {
        this.emulatorHost = emulatorHost;
    }

    public String getCollectionPrefix() {
        return collectionPrefix;
    }

    public void setCollectionPrefix(String collectionPrefix) {
        this.collectionPrefix = collectionPrefix;
    }
}
