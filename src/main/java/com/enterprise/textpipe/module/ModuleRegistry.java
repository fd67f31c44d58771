package com.enterprise.textpipe.module;

import com.enterprise.textpipe.core.TaskIds;
import com.enterprise.textpipe.exception.UnknownModuleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable mapping from module name to its processing capability, built once at startup
 */
public final class ModuleRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ModuleRegistry.class);

    private static final ModuleRegistry EMPTY = new ModuleRegistry(Collections.emptyMap());

    private final Map<String, TextModule> modules;

    private ModuleRegistry(Map<String, TextModule> modules) {
        this.modules = Collections.unmodifiableMap(modules);
    }

    public static ModuleRegistry empty() {
        return EMPTY;
    }

    /**
     * Registry holding the modules shipped with this library
     */
    public static ModuleRegistry defaults() {
        return builder()
            .register(new EchoModule())
            .register(new TokenizeModule())
            .build();
    }

    public static ModuleRegistry of(TextModule... modules) {
        Builder builder = builder();
        for (TextModule module : modules) {
            builder.register(module);
        }
        return builder.build();
    }

    public Optional<TextModule> find(String name) {
        return Optional.ofNullable(modules.get(name));
    }

    /**
     * @throws UnknownModuleException if no module is registered under the name
     */
    public TextModule get(String name) {
        TextModule module = modules.get(name);
        if (module == null) {
            throw new UnknownModuleException(name);
        }
        return module;
    }

    public boolean contains(String name) {
        return modules.containsKey(name);
    }

    public Collection<TextModule> getModules() {
        return modules.values();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for creating registries
     */
    public static class Builder {
        private final Map<String, TextModule> modules = new LinkedHashMap<>();

        public Builder register(TextModule module) {
            String name = TaskIds.requireSafeName(module.getName(), "module name");
            if (modules.putIfAbsent(name, module) != null) {
                throw new IllegalArgumentException("Module already registered: " + name);
            }
            logger.info("Registered module: {}", name);
            return this;
        }

        public ModuleRegistry build() {
            return new ModuleRegistry(new LinkedHashMap<>(modules));
        }
    }
}
