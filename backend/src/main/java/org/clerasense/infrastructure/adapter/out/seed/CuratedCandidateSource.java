package org.clerasense.infrastructure.adapter.out.seed;

import org.clerasense.application.port.CandidateSourcePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public class CuratedCandidateSource implements CandidateSourcePort {

    private static final Logger log = LoggerFactory.getLogger(CuratedCandidateSource.class);

    public static final String DEFAULT_RESOURCE = "seed/curated-drugs.txt";

    private final List<String> names;

    public CuratedCandidateSource() {
        this(DEFAULT_RESOURCE);
    }

    public CuratedCandidateSource(String resourceName) {
        this.names = load(resourceName);
        log.info("Loaded {} candidate drug names from {}", names.size(), resourceName);
    }

    CuratedCandidateSource(List<String> names) {
        this.names = dedupe(names);
    }

    @Override
    public List<String> page(int offset, int limit) {
        if (offset < 0 || limit <= 0) throw new IllegalArgumentException("offset >= 0 and limit > 0 required");
        if (offset >= names.size()) return List.of();
        return List.copyOf(names.subList(offset, Math.min(names.size(), offset + limit)));
    }

    public int size() {
        return names.size();
    }

    private static List<String> load(String resourceName) {
        try (InputStream in = Thread.currentThread()
                .getContextClassLoader()
                .getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IllegalStateException("Candidate list not found on classpath: " + resourceName);
            }
            List<String> raw = new ArrayList<>();
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    String s = line.strip();
                    if (s.isEmpty() || s.startsWith("#")) continue;
                    raw.add(s);
                }
            }
            return dedupe(raw);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read candidate list " + resourceName, e);
        }
    }

    private static List<String> dedupe(List<String> raw) {
        Set<String> seen = new HashSet<>();
        List<String> unique = new ArrayList<>();
        for (String n : raw) {
            if (seen.add(n.toLowerCase(Locale.ROOT))) unique.add(n);
        }
        return List.copyOf(unique);
    }
}
