package com.bulwark.core.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named registry of validators. Names are unique; registering a name again replaces the earlier validator.
 * Iteration follows registration order. Safe for concurrent use.
 */
public class ValidatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ValidatorRegistry.class);

    private final Map<String, Validator> validators = new LinkedHashMap<>();

    public ValidatorRegistry() {
    }

    public ValidatorRegistry(Map<String, ? extends Validator> initial) {
        initial.forEach(this::register);
        log.info("[Bulwark] Registered {} security validators: {}", validators.size(),
                String.join(", ", validators.keySet()));
    }

    /**
     * @return false when the name is blank or the validator is null
     */
    public synchronized boolean register(String name, Validator validator) {
        if (name == null || name.isBlank() || validator == null) {
            log.warn("[Bulwark] Ignoring invalid validator registration: name='{}'", name);
            return false;
        }
        Validator previous = validators.put(name, validator);
        if (previous != null) {
            log.debug("[Bulwark] Validator '{}' replaced", name);
        }
        return true;
    }

    /**
     * @return whether a validator was registered under that name
     */
    public synchronized boolean unregister(String name) {
        return validators.remove(name) != null;
    }

    public synchronized int size() {
        return validators.size();
    }

    public synchronized List<String> getNames() {
        return List.copyOf(validators.keySet());
    }

    /** Point-in-time copy, in registration order. */
    public synchronized Map<String, Validator> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(validators));
    }
}
