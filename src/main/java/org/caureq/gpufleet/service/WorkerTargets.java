package org.caureq.gpufleet.service;

import org.caureq.gpufleet.config.AppProps;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Instance types that run the GPU worker (and so get the long startup timeout).
 * Patterns are comma separated, case-insensitive, {@code *} matches any substring.
 */
@Component
public class WorkerTargets {
    public static final String DEFAULT_PATTERNS = "L4-*,L40S-*,RENDER-S";

    private final List<Pattern> patterns;

    @Autowired
    public WorkerTargets(AppProps props) {
        this(props.worker() == null ? null : props.worker().targetPatterns());
    }

    WorkerTargets(String raw) {
        this.patterns = parse(raw).stream().map(WorkerTargets::compile).toList();
    }

    public boolean matches(String instanceType) {
        if (instanceType == null || instanceType.isBlank()) return false;
        var it = instanceType.trim();
        return patterns.stream().anyMatch(p -> p.matcher(it).matches());
    }

    static List<String> parse(String raw) {
        var out = new ArrayList<String>();
        if (raw != null) {
            for (var s : raw.split(",")) {
                if (!s.isBlank()) out.add(s.trim());
            }
        }
        if (out.isEmpty()) return parse(DEFAULT_PATTERNS);
        return out;
    }

    private static Pattern compile(String glob) {
        var sb = new StringBuilder();
        for (var part : glob.split("\\*", -1)) {
            if (sb.length() > 0 || glob.startsWith("*")) sb.append(".*");
            if (!part.isEmpty()) sb.append(Pattern.quote(part));
        }
        return Pattern.compile(sb.toString(), Pattern.CASE_INSENSITIVE);
    }
}
