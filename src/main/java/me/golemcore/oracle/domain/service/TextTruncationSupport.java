package me.golemcore.oracle.domain.service;

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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Length limiting helpers. Every result fits in the requested limit, omission
 * marker included.
 */
public final class TextTruncationSupport {

    public static final String OMISSION = "...";
    public static final String EXPIRED_PLACEHOLDER = "[CONTENT EXPIRED]";

    private static final Pattern FENCED_BLOCK = Pattern.compile("```([\\w+-]*)\\n(.*?)```", Pattern.DOTALL);

    private TextTruncationSupport() {
    }

    public static String truncateEnd(String text, int limit) {
        if (text == null || text.length() <= limit) {
            return text;
        }
        if (limit <= OMISSION.length()) {
            return text.substring(0, Math.max(0, limit));
        }
        return text.substring(0, limit - OMISSION.length()) + OMISSION;
    }

    public static String truncateMiddle(String text, int limit) {
        if (text == null || text.length() <= limit) {
            return text;
        }
        if (limit <= OMISSION.length()) {
            return text.substring(0, Math.max(0, limit));
        }
        int keep = limit - OMISSION.length();
        int head = (keep + 1) / 2;
        int tail = keep - head;
        return text.substring(0, head) + OMISSION + text.substring(text.length() - tail);
    }

    public static boolean containsCodeBlock(String text) {
        return text != null && FENCED_BLOCK.matcher(text).find();
    }

    /**
     * Replaces the body of every fenced code block with a placeholder, keeping
     * the language label.
     */
    public static String collapseCodeBlocks(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = FENCED_BLOCK.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String replacement = "```" + matcher.group(1) + EXPIRED_PLACEHOLDER + "```";
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Caps text while keeping prose and fence markers intact: code block bodies
     * are shortened first, plain truncation is the last resort.
     */
    public static String truncatePreservingCodeBlocks(String content, int maxLength) {
        if (content == null || content.length() <= maxLength) {
            return content;
        }
        if (!containsCodeBlock(content)) {
            return truncateEnd(content, maxLength);
        }

        String shortened = shortenCodeBodies(content, maxLength / 2);
        if (shortened.length() <= maxLength) {
            return shortened;
        }

        int blocks = 0;
        int codeChars = 0;
        Matcher matcher = FENCED_BLOCK.matcher(content);
        while (matcher.find()) {
            blocks++;
            codeChars += matcher.group(2).length();
        }
        int proseChars = content.length() - codeChars;
        int allowance = (maxLength - proseChars - blocks * (OMISSION.length() + 1)) / blocks;
        if (allowance >= 0) {
            shortened = shortenCodeBodies(content, allowance);
            if (shortened.length() <= maxLength) {
                return shortened;
            }
        }
        return truncateEnd(content, maxLength);
    }

    private static String shortenCodeBodies(String content, int bodyLimit) {
        Matcher matcher = FENCED_BLOCK.matcher(content);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String body = matcher.group(2);
            if (body.length() > bodyLimit) {
                body = body.substring(0, bodyLimit) + OMISSION + "\n";
            }
            String replacement = "```" + matcher.group(1) + "\n" + body + "```";
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
