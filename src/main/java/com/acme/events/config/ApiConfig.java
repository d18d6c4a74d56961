package com.acme.events.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import java.util.HashSet;
import java.util.Set;

/**
 * API key settings for the HTTP boundary.
 */
@ConfigurationProperties("api")
public class ApiConfig {

    private boolean enabled = true;
    private Set<String> keys = new HashSet<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Set<String> getKeys() {
        return keys;
    }

    /** Blank entries are dropped, so an unset key list accepts nothing. */
    public void setKeys(Set<String> keys) {
        this.keys = new HashSet<>();
        if (keys != null) {
            keys.stream().filter(k -> k != null && !k.isBlank()).map(String::trim).forEach(this.keys::add);
        }
    }

    public boolean accepts(String key) {
        return key != null && !key.isBlank() && keys.contains(key);
    }
}
