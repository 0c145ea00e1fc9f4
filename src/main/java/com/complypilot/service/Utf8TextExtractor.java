package com.complypilot.service;

import com.complypilot.model.PolicyDocument;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Best-effort extractor: decodes the raw bytes as UTF-8 and drops undecodable sequences.
 * Binary formats (PDF, Word) yield whatever readable text they embed.
 */
@Service
public class Utf8TextExtractor implements TextExtractor {

    @Override
    public String extract(PolicyDocument document) throws CharacterCodingException {
        if (document.content() == null) {
            throw new IllegalStateException("Document " + document.id() + " has no stored content");
        }
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE)
                .decode(ByteBuffer.wrap(document.content()))
                .toString();
    }
}
