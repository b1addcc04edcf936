package com.confidence.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory store of named {@link DimensionSchema}s.
 *
 * - register/unregister/reset are serialized under the write lock
 * - get/listSchemas/resolve/validate run concurrently under the read lock
 * - a schema can only be registered once its parent is registered
 * - resolve walks the parent chain by name and rejects cycles
 * - validate never throws for data problems; it reports every violation at once
 */
public class DimensionRegistry {

    private static final Logger log = LoggerFactory.getLogger(DimensionRegistry.class);

    private final Map<String, DimensionSchema> schemas = new HashMap<>();
    private final RegistryLock lock = new RegistryLock();

    /**
     * Stores the schema, replacing any schema of the same name.
     *
     * @throws SchemaRegistrationException if the declared parent is not registered
     */
    public void register(DimensionSchema schema) {
        try (RegistryLock.Scope ignored = lock.exclusive()) {
            registerLocked(schema);
        }
    }

    public Optional<DimensionSchema> get(String name) {
        try (RegistryLock.Scope ignored = lock.shared()) {
            return Optional.ofNullable(schemas.get(name));
        }
    }

    /**
     * @return true if a schema with that name was present
     */
    public boolean unregister(String name) {
        try (RegistryLock.Scope ignored = lock.exclusive()) {
            boolean removed = schemas.remove(name) != null;
            if (removed) {
                log.debug("Unregistered schema {}", name);
            }
            return removed;
        }
    }

    /** All schemas sorted by name. */
    public List<DimensionSchema> listSchemas() {
        try (RegistryLock.Scope ignored = lock.shared()) {
            List<DimensionSchema> result = new ArrayList<>(schemas.values());
            result.sort(Comparator.comparing(DimensionSchema::name));
            return result;
        }
    }

    /**
     * Atomically discards every registration and registers {@code baseline} in order.
     */
    public void reset(Collection<DimensionSchema> baseline) {
        try (RegistryLock.Scope ignored = lock.exclusive()) {
            Map<String, DimensionSchema> previous = new HashMap<>(schemas);
            schemas.clear();
            try {
                for (DimensionSchema schema : baseline) {
                    registerLocked(schema);
                }
            } catch (RuntimeException e) {
                schemas.clear();
                schemas.putAll(previous);
                throw e;
            }
            log.debug("Registry reset to {} schemas", schemas.size());
        }
    }

    /**
     * Merges a schema with its ancestors. Ancestor dimensions come first in declared
     * order, followed by each descendant's new dimensions; required is the union along
     * the chain. The result keeps the schema's own name and value range.
     *
     * @throws SchemaRegistrationException if the schema or an ancestor is not registered
     * @throws CircularInheritanceException if the chain loops back on itself
     */
    public DimensionSchema resolve(String name) {
        try (RegistryLock.Scope ignored = lock.shared()) {
            return resolveLocked(name);
        }
    }

    /**
     * Checks a dimension mapping against the resolved schema.
     */
    public ValidationResult validate(String schemaName, Map<String, Double> values) {
        try (RegistryLock.Scope ignored = lock.shared()) {
            if (!schemas.containsKey(schemaName)) {
                return ValidationResult.of(List.of("Unknown schema: " + schemaName));
            }

            DimensionSchema resolved;
            try {
                resolved = resolveLocked(schemaName);
            } catch (SchemaRegistrationException ex) {
                return ValidationResult.of(List.of(ex.getMessage()));
            }

            Map<String, Double> input = values != null ? values : Map.of();
            List<String> errors = new ArrayList<>();

            for (String key : input.keySet()) {
                if (!resolved.dimensions().contains(key)) {
                    errors.add("Unknown dimension: " + key);
                }
            }
            for (String req : resolved.required()) {
                if (!input.containsKey(req)) {
                    errors.add("Missing required dimension: " + req);
                }
            }
            ValueRange range = resolved.valueRange();
            for (Map.Entry<String, Double> entry : input.entrySet()) {
                Double value = entry.getValue();
                if (value == null || !range.contains(value)) {
                    errors.add("Dimension '" + entry.getKey() + "' value " + value
                        + " out of range " + range);
                }
            }

            return ValidationResult.of(errors);
        }
    }

    /**
     * Stores a schema without the parent check. Only for building cyclic
     * configurations in tests.
     */
    void putUnchecked(DimensionSchema schema) {
        try (RegistryLock.Scope ignored = lock.exclusive()) {
            schemas.put(schema.name(), schema);
        }
    }

    private void registerLocked(DimensionSchema schema) {
        if (schema == null) {
            throw new IllegalArgumentException("schema cannot be null");
        }
        if (schema.hasParent() && !schemas.containsKey(schema.inherits())) {
            throw new SchemaRegistrationException(
                "Parent schema '" + schema.inherits() + "' of '" + schema.name() + "' is not registered");
        }
        DimensionSchema previous = schemas.put(schema.name(), schema);
        log.debug("{} schema {} ({} dimensions, inherits={})",
            previous == null ? "Registered" : "Replaced",
            schema.name(), schema.dimensions().size(), schema.inherits());
    }

    private DimensionSchema resolveLocked(String name) {
        DimensionSchema leaf = schemas.get(name);
        if (leaf == null) {
            throw new SchemaRegistrationException("Schema '" + name + "' is not registered");
        }
        if (!leaf.hasParent()) {
            return leaf;
        }

        // Walk upward: chain holds leaf first, root last
        List<DimensionSchema> chain = new ArrayList<>();
        List<String> visited = new ArrayList<>();
        DimensionSchema current = leaf;
        while (current != null) {
            if (visited.contains(current.name())) {
                visited.add(current.name());
                throw new CircularInheritanceException(visited);
            }
            visited.add(current.name());
            chain.add(current);

            if (!current.hasParent()) {
                break;
            }
            DimensionSchema parent = schemas.get(current.inherits());
            if (parent == null) {
                throw new SchemaRegistrationException(
                    "Parent schema '" + current.inherits() + "' of '" + current.name() + "' is not registered");
            }
            current = parent;
        }

        Set<String> dimensions = new LinkedHashSet<>();
        Set<String> required = new LinkedHashSet<>();
        for (int i = chain.size() - 1; i >= 0; i--) {
            dimensions.addAll(chain.get(i).dimensions());
            required.addAll(chain.get(i).required());
        }

        return new DimensionSchema(leaf.name(), new ArrayList<>(dimensions),
            new ArrayList<>(required), leaf.valueRange(), null);
    }
}
