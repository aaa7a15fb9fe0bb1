package com.mcpbridge.core.template;

import com.mcpbridge.core.model.CallerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code {variable}} placeholders in launch strings and validates the results.
 * <p>
 * Substituted values are sanitized before insertion: null bytes are stripped, the characters
 * {@code < > " | * ?} become {@code _}, {@code ..} becomes {@code __} and values are capped at
 * {@value #MAX_VALUE_LENGTH} characters. Unknown variables stay in the output verbatim.
 * <p>
 * Validation only inspects strings: it never executes anything or touches the filesystem,
 * and it does not perform shell expansion.
 */
public class PathTemplateResolver {

    private static final Logger log = LoggerFactory.getLogger(PathTemplateResolver.class);

    static final int MAX_VALUE_LENGTH = 100;
    static final int MAX_PATH_LENGTH = 255;

    private static final Pattern TEMPLATE = Pattern.compile("\\{([^}]+)\\}");
    private static final Pattern INVALID_CHARS = Pattern.compile("[<>\"|*?]");
    private static final Pattern SYSTEM_DIRECTORY = Pattern.compile("^/(?:etc|proc|sys|dev)");
    private static final Pattern RESERVED_NAME =
            Pattern.compile("^(?:CON|PRN|AUX|NUL|COM[1-9]|LPT[1-9])$", Pattern.CASE_INSENSITIVE);

    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final List<String> allowedPrefixes;

    public PathTemplateResolver() {
        this(List.of());
    }

    /**
     * @param extraAllowedPrefixes absolute prefixes accepted in addition to the temp
     *                             directories, the working directory and the home directory
     */
    public PathTemplateResolver(Collection<String> extraAllowedPrefixes) {
        var prefixes = new LinkedHashSet<String>();
        prefixes.add("/tmp");
        prefixes.add("/var/tmp");
        addPrefix(prefixes, System.getProperty("java.io.tmpdir"));
        addPrefix(prefixes, System.getProperty("user.dir"));
        addPrefix(prefixes, System.getProperty("user.home"));
        if (extraAllowedPrefixes != null) {
            extraAllowedPrefixes.forEach(p -> addPrefix(prefixes, p));
        }
        this.allowedPrefixes = List.copyOf(prefixes);
    }

    private static void addPrefix(Set<String> prefixes, String prefix) {
        if (prefix == null || prefix.isBlank()) return;
        String normalized = prefix.length() > 1 && prefix.endsWith("/")
                ? prefix.substring(0, prefix.length() - 1)
                : prefix;
        // "/" would allow every absolute path
        if ("/".equals(normalized)) return;
        prefixes.add(normalized);
    }

    public List<String> getAllowedPrefixes() {
        return allowedPrefixes;
    }

    /**
     * Resolves placeholders in a single template.
     *
     * @param template  the template string
     * @param variables variable values; absent names are left unresolved
     * @return the resolved string
     */
    public String resolve(String template, Map<String, String> variables) {
        return resolve(template, variables, new LinkedHashSet<>());
    }

    private String resolve(String template, Map<String, String> variables, Set<String> unresolved) {
        if (template == null) return null;
        Matcher matcher = TEMPLATE.matcher(template);
        var sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = variables.get(name);
            String replacement;
            if (value == null) {
                log.warn("Template variable not found: {}", name);
                unresolved.add(name);
                replacement = matcher.group();
            } else {
                replacement = sanitizeValue(value);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    public List<String> resolveMany(List<String> templates, Map<String, String> variables) {
        return resolveMany(templates, variables, new LinkedHashSet<>());
    }

    private List<String> resolveMany(List<String> templates, Map<String, String> variables, Set<String> unresolved) {
        var resolved = new ArrayList<String>(templates.size());
        for (String template : templates) {
            resolved.add(resolve(template, variables, unresolved));
        }
        return resolved;
    }

    public Map<String, String> resolveRecord(Map<String, String> templates, Map<String, String> variables) {
        return resolveRecord(templates, variables, new LinkedHashSet<>());
    }

    private Map<String, String> resolveRecord(Map<String, String> templates, Map<String, String> variables,
                                              Set<String> unresolved) {
        var resolved = new LinkedHashMap<String, String>();
        templates.forEach((key, template) -> resolved.put(key, resolve(template, variables, unresolved)));
        return resolved;
    }

    /**
     * Validates a resolved path or command string against the security rules.
     */
    public PathValidationResult validatePath(String path) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();

        if (path.contains("..")) {
            errors.add("Directory traversal sequence '..' in path: " + path);
        }
        if (path.contains("//")) {
            errors.add("Doubled '/' in path: " + path);
        }
        if (SYSTEM_DIRECTORY.matcher(path).find()) {
            errors.add("System directory (/etc, /proc, /sys, /dev) in path: " + path);
        }
        if (INVALID_CHARS.matcher(path).find()) {
            errors.add("Invalid filename character (< > \" | * ?) in path: " + path);
        }
        if (RESERVED_NAME.matcher(lastSegment(path)).matches()) {
            errors.add("Reserved device name in path: " + path);
        }
        if (path.startsWith("/") && !isAllowedAbsolute(path)) {
            errors.add("Absolute path outside allowed directories: " + path);
        }
        if (path.length() > MAX_PATH_LENGTH) {
            errors.add("Path too long: " + path.length() + " characters");
        }
        if (path.indexOf('\0') >= 0) {
            errors.add("Null byte detected in path");
        }

        if (path.contains("~")) {
            warnings.add("Tilde character in path may not expand as expected: " + path);
        }
        if (path.contains("$")) {
            warnings.add("Dollar sign in path may indicate unresolved environment variable: " + path);
        }

        return PathValidationResult.of(errors, warnings);
    }

    private boolean isAllowedAbsolute(String path) {
        for (String prefix : allowedPrefixes) {
            if (path.equals(prefix) || path.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }

    private static String lastSegment(String path) {
        int idx = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return idx >= 0 ? path.substring(idx + 1) : path;
    }

    String sanitizeValue(String value) {
        String sanitized = value.replace("\0", "");
        sanitized = INVALID_CHARS.matcher(sanitized).replaceAll("_");
        sanitized = sanitized.replace("..", "__");
        if (sanitized.length() > MAX_VALUE_LENGTH) {
            log.warn("Template value truncated to {} characters: {}", MAX_VALUE_LENGTH, value);
            sanitized = sanitized.substring(0, MAX_VALUE_LENGTH);
        }
        return sanitized;
    }

    /**
     * Derives template variables from a caller context. Absent source values are omitted.
     */
    public Map<String, String> createVariables(CallerContext context) {
        return createVariables(context.userId(), context.userEmail(), context.sessionId(),
                context.requestId(), context.timestamp());
    }

    public Map<String, String> createVariables(String userId, String userEmail, String sessionId,
                                               String requestId, Instant timestamp) {
        var vars = new LinkedHashMap<String, String>();
        if (userId != null) {
            vars.put("userId", userId);
            vars.put("userDir", "user_" + sanitizeValue(userId));
        }
        if (userEmail != null) {
            vars.put("userEmail", sanitizeValue(userEmail));
        }
        if (sessionId != null) {
            vars.put("sessionId", sessionId);
            vars.put("sessionDir", "session_" + sanitizeValue(sessionId));
        }
        if (requestId != null) {
            vars.put("requestId", requestId);
        }
        if (timestamp != null) {
            String iso = ISO_MILLIS.format(timestamp);
            vars.put("timestamp", iso.replace(':', '-').replace('.', '-'));
            vars.put("dateDir", iso.substring(0, 10));
            vars.put("timeDir", iso.substring(11, 19).replace(':', '-'));
        }
        return vars;
    }

    /**
     * Resolves every launch string and validates the command, the working directory and each
     * path template. Unresolved placeholders left in any string are reported as errors.
     */
    public ResolvedLaunchConfig validateAndResolveConfig(LaunchTemplate config, Map<String, String> variables) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();

        var unresolvedCommand = new LinkedHashSet<String>();
        String command = resolve(config.command(), variables, unresolvedCommand);
        reportUnresolved("command", unresolvedCommand, errors);
        collect(validatePath(command), errors, warnings);

        var unresolvedArgs = new LinkedHashSet<String>();
        List<String> args = resolveMany(config.args(), variables, unresolvedArgs);
        reportUnresolved("args", unresolvedArgs, errors);

        var unresolvedEnv = new LinkedHashSet<String>();
        Map<String, String> env = resolveRecord(config.env(), variables, unresolvedEnv);
        reportUnresolved("env", unresolvedEnv, errors);

        String workingDirectory = null;
        if (config.workingDirectory() != null) {
            var unresolvedWd = new LinkedHashSet<String>();
            workingDirectory = resolve(config.workingDirectory(), variables, unresolvedWd);
            reportUnresolved("workingDirectory", unresolvedWd, errors);
            collect(validatePath(workingDirectory), errors, warnings);
        }

        var pathTemplates = new LinkedHashMap<String, String>();
        for (var entry : config.pathTemplates().entrySet()) {
            var unresolvedPath = new LinkedHashSet<String>();
            String resolvedPath = resolve(entry.getValue(), variables, unresolvedPath);
            reportUnresolved("path template '" + entry.getKey() + "'", unresolvedPath, errors);
            pathTemplates.put(entry.getKey(), resolvedPath);
            PathValidationResult validation = validatePath(resolvedPath);
            if (!validation.valid()) {
                errors.add("Invalid path template '" + entry.getKey() + "': "
                        + String.join(", ", validation.errors()));
            }
            warnings.addAll(validation.warnings());
        }

        var resolved = new LaunchTemplate(command, args, env, workingDirectory, pathTemplates);
        return new ResolvedLaunchConfig(resolved, PathValidationResult.of(errors, warnings));
    }

    private static void reportUnresolved(String field, Set<String> unresolved, List<String> errors) {
        for (String name : unresolved) {
            errors.add("Unresolved template variable '{" + name + "}' in " + field);
        }
    }

    private static void collect(PathValidationResult validation, List<String> errors, List<String> warnings) {
        errors.addAll(validation.errors());
        warnings.addAll(validation.warnings());
    }
}
