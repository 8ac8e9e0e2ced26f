package com.ouroboros.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "ouroboros")
public class SandboxProperties {

    private Sandbox sandbox = new Sandbox();

    // -- Sandbox accessors (delegate to nested) --
    public String getProvider() { return sandbox.provider; }
    public String getImage() { return sandbox.image; }
    public int getMemoryLimitMb() { return sandbox.memoryLimitMb; }
    public double getCpus() { return sandbox.cpus; }
    public int getTimeoutSeconds() { return sandbox.timeoutSeconds; }
    public int getPullTimeoutSeconds() { return sandbox.pullTimeoutSeconds; }

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }

    public static class Sandbox {
        /** "docker" or "local". */
        private String provider = "docker";
        private String image = "alpine:3.19";
        private int memoryLimitMb = 256;
        private double cpus = 0.5;
        private int timeoutSeconds = 60;
        private int pullTimeoutSeconds = 120;

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public int getMemoryLimitMb() { return memoryLimitMb; }
        public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
        public double getCpus() { return cpus; }
        public void setCpus(double cpus) { this.cpus = cpus; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public int getPullTimeoutSeconds() { return pullTimeoutSeconds; }
        public void setPullTimeoutSeconds(int pullTimeoutSeconds) { this.pullTimeoutSeconds = pullTimeoutSeconds; }
    }
}
