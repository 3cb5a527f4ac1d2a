package com.adobe.daiji.config;

import com.adobe.daiji.converter.DaijiConfiguration;
import com.adobe.daiji.converter.DaijiNumeralConverter;
import com.adobe.daiji.converter.DaijiRenderer;
import com.adobe.daiji.converter.NumeralNormalizer;
import com.adobe.daiji.converter.StandardDaijiNumeralConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the daiji converter from {@link DaijiProperties}.
 *
 * <p>The configuration is validated here, so a bad unit or glyph table stops
 * the application at startup with a
 * {@link com.adobe.daiji.exception.ConfigurationException}.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Configuration
@EnableConfigurationProperties(DaijiProperties.class)
public class DaijiConverterConfig {

    private static final Logger logger = LoggerFactory.getLogger(DaijiConverterConfig.class);

    @Bean
    public DaijiNumeralConverter daijiNumeralConverter(DaijiProperties properties) {
        DaijiConfiguration configuration = properties.toConfiguration();
        NumeralNormalizer normalizer = new NumeralNormalizer(properties.getMaxExponent());

        logger.info("Daiji converter configured: {} large units, max exponent {}, {}",
            configuration.getLargeUnitNames().size(), normalizer.getMaxExponent(), configuration);

        return new StandardDaijiNumeralConverter(normalizer, new DaijiRenderer(), configuration);
    }
}
