package com.questrail.penman.codec;

import com.questrail.penman.model.Graph;
import com.questrail.penman.model.Triple;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link PointerNotationDecoder#decode(String)}.
 *
 * <p>Both variants carry a usable graph. Callers that need to tell a genuine
 * decode from a fallback inspect {@link #status()} instead of the graph.</p>
 */
public sealed interface PointerDecodeResult
        permits PointerDecodeResult.Decoded, PointerDecodeResult.Backoff {

    /**
     * Placeholder returned whenever decoding fails: {@code (x1 / string-entity)}.
     */
    Graph BACKOFF_GRAPH = new Graph(List.of(Triple.instance("x1", "string-entity")), "x1");

    Graph graph();

    DecodeStatus status();

    /**
     * Intermediate Penman text the graph was decoded from; empty on backoff.
     */
    Optional<String> penmanText();

    record Decoded(
            Graph graph,
            String text
    ) implements PointerDecodeResult {
        public Decoded {
            Objects.requireNonNull(graph, "graph");
            Objects.requireNonNull(text, "text");
        }

        @Override
        public DecodeStatus status() {
            return DecodeStatus.OK;
        }

        @Override
        public Optional<String> penmanText() {
            return Optional.of(text);
        }
    }

    record Backoff(
            BackoffReason reason,
            String detail
    ) implements PointerDecodeResult {
        public Backoff {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(detail, "detail");
        }

        @Override
        public Graph graph() {
            return BACKOFF_GRAPH;
        }

        @Override
        public DecodeStatus status() {
            return DecodeStatus.BACKOFF;
        }

        @Override
        public Optional<String> penmanText() {
            return Optional.empty();
        }
    }
}
