package com.architecture.inventory.config;

import com.architecture.inventory.model.AssetTypeRegistry;
import com.architecture.inventory.service.AssetTypeRegistryLoader;
import com.architecture.inventory.service.validation.RuleSet;
import com.architecture.inventory.service.validation.StandardRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the type registry and the rule set once at startup.
 */
@Configuration
@Slf4j
@EnableConfigurationProperties(InventoryProperties.class)
public class EngineConfig {

    @Bean
    public AssetTypeRegistry assetTypeRegistry(AssetTypeRegistryLoader loader, InventoryProperties properties) {
        return loader.load(properties.getTypeRegistry());
    }

    @Bean
    public RuleSet ruleSet(AssetTypeRegistry registry) {
        RuleSet ruleSet = new StandardRules(registry).ruleSet();
        log.info("Registered {} validation rules", ruleSet.size());
        return ruleSet;
    }
}
