package com.confidence.config;

import com.confidence.schema.DimensionRegistry;
import com.confidence.schema.DimensionSchema;
import com.confidence.schema.GlobalRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@EnableConfigurationProperties(ConfidenceProperties.class)
public class RegistryConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RegistryConfiguration.class);

    /**
     * Exposes the global registry as a bean. The configured schemas join the global
     * baseline, so {@link GlobalRegistry#reset()} restores them along with the built-ins.
     */
    @Bean
    public DimensionRegistry dimensionRegistry(ConfidenceProperties properties) {
        List<DimensionSchema> schemas = new ArrayList<>();
        for (ConfidenceProperties.SchemaDefinition definition : properties.schemas()) {
            DimensionSchema schema = definition.toSchema();
            schemas.add(schema);
            log.info("Configured schema {} ({} dimensions, inherits={})",
                schema.name(), schema.dimensions().size(), schema.inherits());
        }
        GlobalRegistry.setConfiguredSchemas(schemas);
        return GlobalRegistry.get();
    }
}
