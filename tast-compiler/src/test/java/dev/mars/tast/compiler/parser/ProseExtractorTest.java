/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.tast.compiler.parser;

import dev.mars.tast.core.LiteralValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProseExtractorTest {

    private ProseExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new ProseExtractor();
    }

    @Test
    void testNoiseWordsAndBindingVerbsAreEquivalent() {
        ProseExtractor.Extraction first = extractor.extract("a user with email \"x\"");
        ProseExtractor.Extraction second = extractor.extract("the user has email \"x\"");

        assertEquals("user email \"x\"", first.getNormalizedText());
        assertEquals(first.getNormalizedText(), second.getNormalizedText());
        assertEquals(Map.of("email", LiteralValue.ofString("x")), first.getData());
        assertEquals(first.getData(), second.getData());
    }

    @Test
    void testLiteralBindsToPrecedingWord() {
        ProseExtractor.Extraction extraction = extractor.extract("a cart with total 42.5 and timeout 30s");

        assertEquals(LiteralValue.ofNumber("42.5"), extraction.getData().get("total"));
        assertEquals(LiteralValue.ofDuration("30s"), extraction.getData().get("timeout"));
        assertEquals(2, extraction.getData().size());
    }

    @Test
    void testLiteralWithoutPrecedingWordIsAnonymous() {
        ProseExtractor.Extraction extraction = extractor.extract("\"alice\" and \"bob\" are friends");

        assertEquals(LiteralValue.ofString("alice"), extraction.getData().get("$0"));
        assertEquals(LiteralValue.ofString("bob"), extraction.getData().get("$1"));
    }

    @Test
    void testSecondLiteralAfterBindingIsAnonymous() {
        ProseExtractor.Extraction extraction = extractor.extract("code 200 404");

        assertEquals(LiteralValue.ofNumber("200"), extraction.getData().get("code"));
        assertEquals(LiteralValue.ofNumber("404"), extraction.getData().get("$0"));
    }

    @Test
    void testPlaceholdersBecomeParameters() {
        ProseExtractor.Extraction extraction = extractor.extract("the user logs in with <email> and <password> as <email>");

        assertEquals(List.of("email", "password"), extraction.getParameters());
        assertTrue(extraction.getData().isEmpty());
        assertEquals("user logs in <email> and <password> as <email>", extraction.getNormalizedText());
    }

    @Test
    void testFixtureReference() {
        ProseExtractor.Extraction extraction = extractor.extract("a user from fixture AdminUser");

        assertEquals("AdminUser", extraction.getFixtureReference());
        assertEquals("user from fixture adminuser", extraction.getNormalizedText());
    }

    @Test
    void testWordsAreLowercased() {
        assertEquals("response status 200", extractor.extract("The Response status is 200").getNormalizedText());
    }

    @Test
    void testEmptyText() {
        ProseExtractor.Extraction extraction = extractor.extract("");

        assertEquals("", extraction.getNormalizedText());
        assertTrue(extraction.getData().isEmpty());
        assertTrue(extraction.getParameters().isEmpty());
        assertNull(extraction.getFixtureReference());
    }
}
