package com.questrail.penman.codec;

import com.questrail.penman.model.Graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of {@link PointerNotationParser#parse(String)}.
 */
public sealed interface PointerParseResult
        permits PointerParseResult.Parsed, PointerParseResult.Failed {

    boolean isParsed();

    /**
     * The input converted successfully.
     *
     * @param pointerText   canonical pointer-token string
     * @param graph         the input graph with node names replaced by pointer tokens
     * @param pointerByName pointer token allocated for each node name, in
     *                      allocation order
     */
    record Parsed(
            String pointerText,
            Graph graph,
            Map<String, String> pointerByName
    ) implements PointerParseResult {
        public Parsed {
            Objects.requireNonNull(pointerText, "pointerText");
            Objects.requireNonNull(graph, "graph");
            pointerByName = Collections.unmodifiableMap(new LinkedHashMap<>(pointerByName));
        }

        @Override
        public boolean isParsed() {
            return true;
        }
    }

    /**
     * The input was rejected; nothing was salvaged.
     */
    record Failed(
            PointerParseError kind,
            String detail
    ) implements PointerParseResult {
        public Failed {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(detail, "detail");
        }

        @Override
        public boolean isParsed() {
            return false;
        }
    }
}
