package com.pdp.adapter.spring;

import com.pdp.config.document.DocumentFormat;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the policy decision point.
 */
@ConfigurationProperties(prefix = "pdp")
public class PdpProperties {

    /**
     * Whether the decision point is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the policy document loaded at startup.
     * Supports classpath: prefix for classpath resources. When unset the store starts empty
     * and every request is NotApplicable until a document is loaded.
     */
    private String policyPath;

    /**
     * Syntax of the policy document. Guessed from the file extension when unset.
     */
    private DocumentFormat format;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getPolicyPath() {
        return policyPath;
    }

    public void setPolicyPath(String policyPath) {
        this.policyPath = policyPath;
    }

    public DocumentFormat getFormat() {
        return format;
    }

    public void setFormat(DocumentFormat format) {
        this.format = format;
    }
}
