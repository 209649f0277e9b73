package com.dealgrid.app.config;

import com.dealgrid.app.formula.FormulaEvaluator;
import com.dealgrid.app.formula.functions.FunctionLibrary;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared engine beans. The function library and evaluator are stateless, so every
 * workbook uses the same instances.
 */
@Configuration
public class GridConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public FunctionLibrary functionLibrary() {
        return FunctionLibrary.standard();
    }

    @Bean
    public FormulaEvaluator formulaEvaluator(FunctionLibrary functionLibrary) {
        return new FormulaEvaluator(functionLibrary);
    }
}
