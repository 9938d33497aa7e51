package com.calc;

import com.calc.adapter.spring.CalcProperties;
import com.calc.shell.CalculatorShell;
import com.calc.spring.EnableCalc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Spring Boot application running the calculator shell on the console.
 */
@SpringBootApplication
@EnableCalc
public class CalcApplication {

    private static final Logger log = LoggerFactory.getLogger(CalcApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(CalcApplication.class, args);
    }

    @Bean
    public CommandLineRunner shell(CalculatorShell shell, CalcProperties properties) {
        return args -> {
            if (!properties.isInteractive()) {
                log.info("Interactive shell disabled (calc.interactive=false)");
                return;
            }
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            int evaluated = shell.run(in, System.out);
            log.info("Session ended, {} expressions evaluated", evaluated);
        };
    }
}
