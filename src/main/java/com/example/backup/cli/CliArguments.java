package com.example.backup.cli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 명령행 인자: 위치 인자(명령어) + --옵션 값 / --옵션=값 / --플래그
 */
public class CliArguments {

    private final List<String> positionals;
    private final Map<String, String> options;

    private CliArguments(List<String> positionals, Map<String, String> options) {
        this.positionals = positionals;
        this.options = options;
    }

    public static CliArguments parse(String... args) {
        List<String> positionals = new ArrayList<>();
        Map<String, String> options = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                positionals.add(arg);
                continue;
            }
            String name = arg.substring(2);
            int eq = name.indexOf('=');
            if (eq >= 0) {
                options.put(name.substring(0, eq), name.substring(eq + 1));
            } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                options.put(name, args[++i]);
            } else {
                options.put(name, "true");
            }
        }
        return new CliArguments(Collections.unmodifiableList(positionals), Collections.unmodifiableMap(options));
    }

    /**
     * "backup create" 처럼 앞의 두 위치 인자
     */
    public String command() {
        if (positionals.size() < 2) {
            return positionals.isEmpty() ? "" : positionals.get(0);
        }
        return positionals.get(0) + " " + positionals.get(1);
    }

    public String option(String name) {
        return options.get(name);
    }

    public String option(String name, String defaultValue) {
        return options.getOrDefault(name, defaultValue);
    }

    public String require(String name) {
        String value = options.get(name);
        if (value == null || value.isBlank() || "true".equals(value)) {
            throw new IllegalArgumentException("Missing required option --" + name);
        }
        return value;
    }

    public boolean flag(String name) {
        return Boolean.parseBoolean(options.getOrDefault(name, "false"));
    }

    public List<String> getPositionals() {
        return positionals;
    }
}
