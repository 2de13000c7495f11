package com.reelindex.service.inference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Byte-level BPE tokenizer for the CLIP text encoder, built from a Hugging
 * Face {@code tokenizer.json}.
 *
 * Sequences are {@code [<|startoftext|>] tokens... [<|endoftext|>]}, truncated
 * to fit and zero-padded to {@link #CONTEXT_LENGTH}.
 */
public final class ClipTokenizer {

    public static final int CONTEXT_LENGTH = 77;
    static final int START_OF_TEXT = 49406;
    static final int END_OF_TEXT = 49407;

    private static final Pattern WORDS = Pattern.compile(
            "'s|'t|'re|'ve|'m|'ll|'d|[\\p{L}]+|[\\p{N}]|[^\\s\\p{L}\\p{N}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String[] BYTE_SYMBOLS = byteSymbols();

    private final Map<String, Integer> vocab;
    private final Map<String, Integer> mergeRanks;
    private final Map<String, List<String>> bpeCache = new ConcurrentHashMap<>();

    ClipTokenizer(Map<String, Integer> vocab, Map<String, Integer> mergeRanks) {
        this.vocab = vocab;
        this.mergeRanks = mergeRanks;
    }

    /**
     * Reads {@code model.vocab} and {@code model.merges} from a tokenizer.json.
     * Merges may be given either as "a b" strings or as ["a", "b"] pairs.
     */
    public static ClipTokenizer fromFile(Path tokenizerJson) throws IOException {
        JsonNode model = new ObjectMapper().readTree(tokenizerJson.toFile()).path("model");

        Map<String, Integer> vocab = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = model.path("vocab").fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            vocab.put(entry.getKey(), entry.getValue().asInt());
        }

        Map<String, Integer> ranks = new HashMap<>();
        JsonNode merges = model.path("merges");
        for (int rank = 0; rank < merges.size(); rank++) {
            JsonNode merge = merges.get(rank);
            String pair = merge.isArray() ? merge.get(0).asText() + " " + merge.get(1).asText() : merge.asText();
            ranks.putIfAbsent(pair, rank);
        }
        if (vocab.isEmpty() || ranks.isEmpty()) {
            throw new IOException("tokenizer.json has no BPE vocabulary: " + tokenizerJson);
        }
        return new ClipTokenizer(vocab, ranks);
    }

    /**
     * Encodes {@code text} into exactly {@link #CONTEXT_LENGTH} token ids.
     */
    public long[] encode(String text) {
        String cleaned = WHITESPACE.matcher(text.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);

        List<Integer> ids = new ArrayList<>();
        Matcher words = WORDS.matcher(cleaned);
        while (words.find()) {
            for (String piece : bpe(toByteSymbols(words.group()))) {
                Integer id = vocab.get(piece);
                if (id != null) {
                    ids.add(id);
                }
            }
        }

        long[] out = new long[CONTEXT_LENGTH];
        int length = Math.min(ids.size(), CONTEXT_LENGTH - 2);
        out[0] = START_OF_TEXT;
        for (int i = 0; i < length; i++) {
            out[i + 1] = ids.get(i);
        }
        out[length + 1] = END_OF_TEXT;
        return out;
    }

    private static String toByteSymbols(String word) {
        StringBuilder sb = new StringBuilder();
        for (byte b : word.getBytes(StandardCharsets.UTF_8)) {
            sb.append(BYTE_SYMBOLS[b & 0xFF]);
        }
        return sb.toString();
    }

    /** Greedy lowest-rank merging; the final symbol of a word carries the {@code </w>} marker. */
    private List<String> bpe(String word) {
        return bpeCache.computeIfAbsent(word, w -> {
            List<String> symbols = new ArrayList<>();
            w.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
            int last = symbols.size() - 1;
            symbols.set(last, symbols.get(last) + "</w>");

            while (symbols.size() > 1) {
                int bestRank = Integer.MAX_VALUE;
                int bestAt = -1;
                for (int i = 0; i < symbols.size() - 1; i++) {
                    Integer rank = mergeRanks.get(symbols.get(i) + " " + symbols.get(i + 1));
                    if (rank != null && rank < bestRank) {
                        bestRank = rank;
                        bestAt = i;
                    }
                }
                if (bestAt < 0) {
                    break;
                }
                symbols.set(bestAt, symbols.get(bestAt) + symbols.remove(bestAt + 1));
            }
            return List.copyOf(symbols);
        });
    }

    /**
     * GPT-2 byte-to-unicode table: printable Latin-1 bytes map to themselves,
     * the rest are shifted above U+0100 so every byte has a visible symbol.
     */
    private static String[] byteSymbols() {
        String[] table = new String[256];
        int shifted = 0;
        for (int b = 0; b < 256; b++) {
            boolean printable = (b >= '!' && b <= '~') || (b >= 0xA1 && b <= 0xAC) || (b >= 0xAE && b <= 0xFF);
            table[b] = printable ? String.valueOf((char) b) : String.valueOf((char) (256 + shifted++));
        }
        return table;
    }
}
