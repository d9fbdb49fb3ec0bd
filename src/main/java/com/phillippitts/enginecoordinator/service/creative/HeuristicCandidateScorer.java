package com.phillippitts.enginecoordinator.service.creative;

import com.phillippitts.enginecoordinator.service.recall.HashingEmbedder;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Token-set scorer.
 *
 * <ul>
 *   <li>Novelty: mean Jaccard distance from the prompt and from the peer drafts.</li>
 *   <li>Feasibility: share of the prompt's key terms the draft addresses, penalised for very
 *       short or very long drafts.</li>
 * </ul>
 */
public class HeuristicCandidateScorer implements CandidateScorer {

    static final int MIN_TOKENS = 5;
    static final int MAX_TOKENS = 200;

    @Override
    public CandidateScore score(String prompt, String candidate, List<String> peers) {
        Set<String> tokens = tokens(candidate);
        Set<String> promptTokens = tokens(prompt);

        double fromPrompt = 1.0 - jaccard(tokens, promptTokens);
        double novelty = fromPrompt;
        if (peers != null && !peers.isEmpty()) {
            double sum = 0;
            for (String peer : peers) {
                sum += 1.0 - jaccard(tokens, tokens(peer));
            }
            novelty = (fromPrompt + sum / peers.size()) / 2.0;
        }

        double coverage;
        if (promptTokens.isEmpty()) {
            coverage = 0.5;
        } else {
            int covered = 0;
            for (String t : promptTokens) {
                if (tokens.contains(t)) {
                    covered++;
                }
            }
            coverage = (double) covered / promptTokens.size();
        }
        int length = HashingEmbedder.tokenize(candidate).size();
        double feasibility = clamp(coverage * lengthFactor(length));
        return new CandidateScore(clamp(novelty), feasibility);
    }

    @Override
    public double similarity(String a, String b) {
        return jaccard(tokens(a), tokens(b));
    }

    static double lengthFactor(int tokenCount) {
        if (tokenCount < MIN_TOKENS) {
            return (double) tokenCount / MIN_TOKENS;
        }
        if (tokenCount > MAX_TOKENS) {
            return (double) MAX_TOKENS / tokenCount;
        }
        return 1.0;
    }

    private static Set<String> tokens(String text) {
        return new HashSet<>(HashingEmbedder.tokenize(text));
    }

    private static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        int intersection = 0;
        for (String t : a) {
            if (b.contains(t)) {
                intersection++;
            }
        }
        return (double) intersection / union.size();
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
