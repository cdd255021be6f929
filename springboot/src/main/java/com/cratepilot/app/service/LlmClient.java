package com.cratepilot.app.service;

import com.cratepilot.app.exception.LlmException;

/**
 * Generative language model: one prompt in, one text response out.
 */
public interface LlmClient {

    /**
     * @throws LlmException when the model cannot be reached, errors, or misses its deadline
     */
    String execute(String prompt);
}
