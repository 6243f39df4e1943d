package me.golemcore.callboard.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Translates between working directories and the folder names the session log
 * store uses for them.
 *
 * <p>
 * The store replaces every character outside {@code [A-Za-z0-9]} with a dash,
 * so {@code -home-dev-my-app} may stand for {@code /home/dev/my-app},
 * {@code /home/dev/my/app} or {@code /home/dev/my.app}. Decoding walks the
 * dashes left to right and commits a path separator wherever the prefix is an
 * existing directory. When the result does not exist, dashes that were
 * originally dots are recovered by probing the filesystem. Decoding never
 * fails: the greedy result is returned as a best effort.
 */
@Component
public class ProjectDirectoryCodec {

    private static final int MAX_SEGMENT_DASH_VARIANTS = 6;
    private static final int MAX_MERGED_SEGMENTS = 6;
    private static final int MAX_MIXED_MERGE = 4;

    public String encode(String directory) {
        return directory.replaceAll("[^A-Za-z0-9]", "-");
    }

    public String decode(String encoded) {
        if (encoded == null || encoded.length() <= 1) {
            return "/";
        }
        String[] parts = encoded.substring(1).split("-", -1);

        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            List<String> candidate = new ArrayList<>(segments);
            candidate.add(current.toString());
            if (isDirectory(join(candidate))) {
                segments.add(current.toString());
                current = new StringBuilder(parts[i]);
            } else {
                current.append('-').append(parts[i]);
            }
        }
        segments.add(current.toString());

        String resolved = join(segments);
        if (exists(resolved)) {
            return resolved;
        }
        return recoverDots(segments).orElse(resolved);
    }

    private Optional<String> recoverDots(List<String> segments) {
        // dots inside a single segment, rightmost first
        for (int index = segments.size() - 1; index >= 0; index--) {
            String segment = segments.get(index);
            if (segment.indexOf('-') < 0) {
                continue;
            }
            for (String variant : dotVariants(segment)) {
                List<String> candidate = new ArrayList<>(segments);
                candidate.set(index, variant);
                String path = join(candidate);
                if (exists(path)) {
                    return Optional.of(path);
                }
            }
        }

        // a trailing run of segments split at a directory that exists by coincidence
        int size = segments.size();
        for (int mergeCount = 2; mergeCount <= Math.min(size, MAX_MERGED_SEGMENTS); mergeCount++) {
            String prefix = prefixPath(segments, size - mergeCount);
            List<String> merged = segments.subList(size - mergeCount, size);

            String allDots = prefix + "/" + String.join(".", merged);
            if (exists(allDots)) {
                return Optional.of(allDots);
            }
            if (mergeCount > MAX_MIXED_MERGE) {
                continue;
            }
            int separators = mergeCount - 1;
            for (int mask = 1; mask < (1 << separators) - 1; mask++) {
                StringBuilder joined = new StringBuilder(merged.get(0));
                for (int i = 0; i < separators; i++) {
                    joined.append((mask & (1 << i)) != 0 ? '.' : '/').append(merged.get(i + 1));
                }
                String path = prefix + "/" + joined;
                if (exists(path)) {
                    return Optional.of(path);
                }
            }
        }

        // both: merge, then turn remaining dashes into dots
        for (int mergeCount = 2; mergeCount <= Math.min(size, MAX_MIXED_MERGE); mergeCount++) {
            String prefix = prefixPath(segments, size - mergeCount);
            String dotJoined = String.join(".", segments.subList(size - mergeCount, size));
            if (dotJoined.indexOf('-') < 0) {
                continue;
            }
            for (String variant : dotVariants(dotJoined)) {
                String path = prefix + "/" + variant;
                if (exists(path)) {
                    return Optional.of(path);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Every way of turning some dashes of {@code segment} into dots, all-dots
     * first, excluding the segment itself. Segments with many dashes only get
     * the all-dots variant.
     */
    List<String> dotVariants(String segment) {
        List<Integer> dashes = new ArrayList<>();
        for (int i = 0; i < segment.length(); i++) {
            if (segment.charAt(i) == '-') {
                dashes.add(i);
            }
        }
        if (dashes.isEmpty()) {
            return List.of();
        }
        List<String> variants = new ArrayList<>();
        variants.add(segment.replace('-', '.'));
        if (dashes.size() > MAX_SEGMENT_DASH_VARIANTS) {
            return variants;
        }
        int combinations = 1 << dashes.size();
        for (int mask = 1; mask < combinations - 1; mask++) {
            char[] chars = segment.toCharArray();
            for (int i = 0; i < dashes.size(); i++) {
                if ((mask & (1 << i)) != 0) {
                    chars[dashes.get(i)] = '.';
                }
            }
            variants.add(new String(chars));
        }
        return variants;
    }

    private static String prefixPath(List<String> segments, int count) {
        return count > 0 ? join(segments.subList(0, count)) : "";
    }

    private static String join(List<String> segments) {
        return "/" + String.join("/", segments);
    }

    private static boolean isDirectory(String path) {
        try {
            return Files.isDirectory(Paths.get(path));
        } catch (InvalidPathException e) {
            return false;
        }
    }

    private static boolean exists(String path) {
        try {
            return Files.exists(Paths.get(path));
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
