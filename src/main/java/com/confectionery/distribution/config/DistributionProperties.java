package com.confectionery.distribution.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bootstrap settings under {@code distribution.*}.
 */
@ConfigurationProperties(prefix = "distribution")
public class DistributionProperties {

    private final Admin admin = new Admin();

    // Demo manager, products and shop for a fresh database
    private boolean seedDemoData = false;

    public Admin getAdmin() {
        return admin;
    }

    public boolean isSeedDemoData() {
        return seedDemoData;
    }

    public void setSeedDemoData(boolean seedDemoData) {
        this.seedDemoData = seedDemoData;
    }

    public static class Admin {
        private String username = "admin";
        private String password = "admin";
        private String fullName = "System Admin";

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

        public String getFullName() {
            return fullName;
        }

        public void setFullName(String fullName) {
            this.fullName = fullName;
        }
    }
}
