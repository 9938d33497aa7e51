package com.calc.adapter.spring;

import com.calc.config.CalcConfig;
import com.calc.config.ConfigLoader;
import com.calc.core.Calculator;
import com.calc.core.DefaultCalculator;
import com.calc.format.ResultFormatter;
import com.calc.shell.CalculatorShell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the calculator.
 */
@Configuration
@ConditionalOnProperty(prefix = "calc", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CalcProperties.class)
public class CalcAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CalcAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public CalcConfig calcConfig(CalcProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public Calculator calculator() {
        log.info("Creating Calculator: {}", DefaultCalculator.class.getSimpleName());
        return new DefaultCalculator();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResultFormatter resultFormatter(CalcConfig config) {
        return new ResultFormatter(config.precision());
    }

    @Bean
    @ConditionalOnMissingBean
    public CalculatorShell calculatorShell(Calculator calculator, ResultFormatter formatter, CalcConfig config) {
        log.info("Creating CalculatorShell: {}", config.name());
        return new CalculatorShell(calculator, formatter, config);
    }
}
