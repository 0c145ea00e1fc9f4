package com.complypilot.service;

import com.complypilot.model.PolicyDocument;

/**
 * Turns stored document content into text for analysis.
 */
public interface TextExtractor {

    /**
     * @throws Exception when the content cannot be turned into text at all
     */
    String extract(PolicyDocument document) throws Exception;
}
