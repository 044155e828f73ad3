package com.raditha.copycheck.shingle;

import com.raditha.copycheck.fingerprint.StructuralFingerprinter;
import com.raditha.copycheck.model.Digest;
import com.raditha.copycheck.model.NormalizedDocument;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Slides a fixed window of {@value #SHINGLE_SIZE} lines over a document and
 * indexes each window's digest by its start position.
 */
public class ShingleIndexer {

    /** Lines per shingle. */
    public static final int SHINGLE_SIZE = 3;

    private final StructuralFingerprinter fingerprinter;
    private final ShingleHasher hasher;

    public ShingleIndexer() {
        this(new StructuralFingerprinter(), new ShingleHasher());
    }

    public ShingleIndexer(StructuralFingerprinter fingerprinter, ShingleHasher hasher) {
        this.fingerprinter = fingerprinter;
        this.hasher = hasher;
    }

    public ShingleIndex index(NormalizedDocument document) {
        return index(document.texts());
    }

    /**
     * Build the index. Fewer than {@value #SHINGLE_SIZE} lines give an empty
     * index.
     */
    public ShingleIndex index(List<String> normalizedLines) {
        List<Digest> sequence = digestSequence(normalizedLines);
        if (sequence.isEmpty()) {
            return ShingleIndex.empty();
        }

        Map<Digest, List<Integer>> positions = new LinkedHashMap<>();
        for (int start = 0; start < sequence.size(); start++) {
            positions.computeIfAbsent(sequence.get(start), d -> new ArrayList<>()).add(start);
        }
        return new ShingleIndex(positions);
    }

    /**
     * Digest of every window, in window-start order.
     */
    public List<Digest> digestSequence(List<String> normalizedLines) {
        if (normalizedLines.size() < SHINGLE_SIZE) {
            return List.of();
        }
        List<Digest> digests = new ArrayList<>(normalizedLines.size() - SHINGLE_SIZE + 1);
        for (int start = 0; start <= normalizedLines.size() - SHINGLE_SIZE; start++) {
            String window = String.join("\n", normalizedLines.subList(start, start + SHINGLE_SIZE));
            digests.add(hasher.hash(fingerprinter.fingerprint(window)));
        }
        return digests;
    }
}
