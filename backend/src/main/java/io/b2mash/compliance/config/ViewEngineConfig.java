package io.b2mash.compliance.config;

import io.b2mash.compliance.view.property.PropertyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ViewsProperties.class)
public class ViewEngineConfig {

  private static final Logger log = LoggerFactory.getLogger(ViewEngineConfig.class);

  @Bean
  PropertyRegistry propertyRegistry(ViewsProperties viewsProperties) {
    var registry = new PropertyRegistry(viewsProperties.toModuleConfigs());
    log.info("Loaded view module configuration: entityTypes={}", registry.entityTypes());
    return registry;
  }
}
