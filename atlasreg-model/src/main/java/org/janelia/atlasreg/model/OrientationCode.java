package org.janelia.atlasreg.model;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;

/**
 * Anatomical orientation written as three colon separated direction tokens, e.g. "LR:SI:PA".
 * A valid code names each of the left-right, superior-inferior and anterior-posterior axes exactly once.
 */
public class OrientationCode {

    private static final List<List<String>> AXIS_PAIRS = ImmutableList.of(
            ImmutableList.of("LR", "RL"),
            ImmutableList.of("SI", "IS"),
            ImmutableList.of("AP", "PA")
    );

    private final String code;
    private final List<String> tokens;

    private OrientationCode(String code, List<String> tokens) {
        this.code = code;
        this.tokens = tokens;
    }

    public static OrientationCode parse(String code) {
        List<String> violations = check(code);
        if (!violations.isEmpty()) {
            throw new IllegalArgumentException(String.join("; ", violations));
        }
        return new OrientationCode(code, ImmutableList.copyOf(tokenize(code)));
    }

    /**
     * @return the problems of the given code; empty if the code is valid
     */
    public static List<String> check(String code) {
        List<String> violations = new ArrayList<>();
        if (StringUtils.isBlank(code)) {
            violations.add("orientation code is missing");
            return violations;
        }
        List<String> tokens = tokenize(code);
        if (tokens.size() != 3) {
            violations.add("orientation code " + code + " must have exactly 3 tokens");
        }
        for (List<String> pair : AXIS_PAIRS) {
            long count = tokens.stream().filter(pair::contains).count();
            if (count != 1) {
                violations.add("orientation code " + code + " must name the " + pair.get(0) + " axis exactly once");
            }
        }
        tokens.stream()
                .filter(t -> AXIS_PAIRS.stream().noneMatch(pair -> pair.contains(t)))
                .forEach(t -> violations.add("orientation code " + code + " has an unknown token " + t));
        return violations;
    }

    private static List<String> tokenize(String code) {
        return Splitter.on(':').trimResults().splitToList(code.toUpperCase());
    }

    public List<String> getTokens() {
        return tokens;
    }

    public String getCode() {
        return code;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return tokens.equals(((OrientationCode) o).tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return code;
    }
}
