package org.janelia.spatialnorm.cdi;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.enterprise.inject.spi.InjectionPoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.janelia.spatialnorm.cdi.qualifier.ApplicationProperties;
import org.janelia.spatialnorm.cdi.qualifier.PropertyValue;
import org.janelia.spatialnorm.cdi.qualifier.StrPropertyValue;
import org.janelia.spatialnorm.config.ApplicationConfig;

@ApplicationScoped
public class ApplicationProducer {

    @Produces
    public ObjectMapper objectMapper() {
        return ObjectMapperFactory.instance().getDefaultObjectMapper();
    }

    @PropertyValue(name = "")
    @Produces
    public String stringPropertyValue(@ApplicationProperties ApplicationConfig applicationConfig, InjectionPoint injectionPoint) {
        final PropertyValue property = injectionPoint.getAnnotated().getAnnotation(PropertyValue.class);
        return applicationConfig.getStringPropertyValue(property.name());
    }

    @StrPropertyValue(name = "")
    @Produces
    public String stringPropertyValueWithDefault(@ApplicationProperties ApplicationConfig applicationConfig, InjectionPoint injectionPoint) {
        final StrPropertyValue property = injectionPoint.getAnnotated().getAnnotation(StrPropertyValue.class);
        return applicationConfig.getStringPropertyValue(property.name(), property.defaultValue());
    }

    @ApplicationProperties
    @ApplicationScoped
    @Produces
    public ApplicationConfig applicationConfig() {
        return new ApplicationConfigProvider()
                .fromDefaultResources()
                .fromEnvVar("SPATIALNORM_CONFIG")
                .fromMap(ApplicationConfigProvider.getAppDynamicArgs())
                .build();
    }
}
