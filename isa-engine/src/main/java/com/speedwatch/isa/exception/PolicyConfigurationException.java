package com.speedwatch.isa.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when an enforcement policy cannot be applied as configured.
 */
@Getter
public class PolicyConfigurationException extends RuntimeException {

    private final List<String> problems;

    public PolicyConfigurationException(List<String> problems) {
        super("Invalid ISA policy: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
}
