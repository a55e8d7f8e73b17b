package com.dice;

import com.dice.cli.DiceCommandRunner;
import com.dice.engine.DiceEngine;
import com.dice.spring.EnableDice;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Command line dice roller.
 * <pre>
 * dice 4d6kh3 + 2
 * dice max 2d20adv
 * dice dot "(1d4 + 1) * 3"
 * </pre>
 */
@SpringBootApplication
@EnableDice
public class DiceApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(DiceApplication.class, args)));
    }

    @Bean
    public DiceCommandRunner diceCommandRunner(DiceEngine engine) {
        return new DiceCommandRunner(engine, System.out, System.err);
    }
}
