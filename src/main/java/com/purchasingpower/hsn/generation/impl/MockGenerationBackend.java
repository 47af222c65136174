package com.purchasingpower.hsn.generation.impl;

import com.purchasingpower.hsn.generation.GenerationBackend;
import lombok.extern.slf4j.Slf4j;

/**
 * Offline backend that echoes the head of the prompt. No network calls.
 */
@Slf4j
public class MockGenerationBackend implements GenerationBackend {

    static final int ECHO_LENGTH = 500;

    @Override
    public String generate(String prompt) {
        log.info("Using mock generation backend");
        String head = prompt.length() > ECHO_LENGTH ? prompt.substring(0, ECHO_LENGTH) : prompt;
        return "Mock response based on the following context:\n---\n" + head + "...\n---";
    }

    @Override
    public String name() {
        return "mock";
    }
}
