package com.mcpbridge.core.template;

import com.mcpbridge.core.model.CallerContext;
import com.mcpbridge.core.model.LifecycleMode;
import com.mcpbridge.core.model.ServerDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PathTemplateResolverTest {

    private PathTemplateResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new PathTemplateResolver(List.of("/srv/mcp/"));
    }

    // -- Resolution -----------------------------------------------------------

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("substitutes known variables")
        void substitutesKnownVariables() {
            assertEquals("u1", resolver.resolve("{userId}", Map.of("userId", "u1")));
            assertEquals("/tmp/data/u1/s1",
                    resolver.resolve("/tmp/data/{userId}/{sessionId}", Map.of("userId", "u1", "sessionId", "s1")));
        }

        @Test
        @DisplayName("leaves unknown variables verbatim")
        void leavesUnknownVerbatim() {
            assertEquals("/tmp/u1/{missing}", resolver.resolve("/tmp/{userId}/{missing}", Map.of("userId", "u1")));
        }

        @Test
        @DisplayName("sanitizes substituted values so they cannot traverse")
        void sanitizesValues() {
            String resolved = resolver.resolve("/tmp/{userId}/data", Map.of("userId", "../../etc"));

            assertEquals("/tmp/__/__/etc/data", resolved);
            assertTrue(resolver.validatePath(resolved).valid());
        }

        @Test
        @DisplayName("replacement text with regex metacharacters is inserted literally")
        void literalReplacement() {
            assertEquals("/tmp/a$1b", resolver.resolve("/tmp/{x}", Map.of("x", "a$1b")));
        }

        @Test
        @DisplayName("resolveMany and resolveRecord apply the same substitution")
        void manyAndRecord() {
            var vars = Map.of("userId", "u1");

            assertEquals(List.of("--user", "u1", "{other}"),
                    resolver.resolveMany(List.of("--user", "{userId}", "{other}"), vars));
            assertEquals(Map.of("HOME", "/tmp/u1"),
                    resolver.resolveRecord(Map.of("HOME", "/tmp/{userId}"), vars));
        }
    }

    // -- Sanitizing -----------------------------------------------------------

    @Nested
    @DisplayName("sanitizeValue")
    class Sanitize {

        @Test
        void stripsNullBytes() {
            assertEquals("ab", resolver.sanitizeValue("a\0b"));
        }

        @Test
        void replacesInvalidCharacters() {
            assertEquals("a_b_c_d_e_f_", resolver.sanitizeValue("a<b>c\"d|e*f?"));
        }

        @Test
        void replacesDotDot() {
            assertEquals("a__b", resolver.sanitizeValue("a..b"));
        }

        @Test
        void truncatesLongValues() {
            String sanitized = resolver.sanitizeValue("x".repeat(150));
            assertEquals(PathTemplateResolver.MAX_VALUE_LENGTH, sanitized.length());
        }
    }

    // -- Validation -----------------------------------------------------------

    @Nested
    @DisplayName("validatePath")
    class ValidatePath {

        @Test
        @DisplayName("accepts paths under the temp directories")
        void acceptsTempPaths() {
            var result = resolver.validatePath("/tmp/safe/file");

            assertTrue(result.valid());
            assertTrue(result.errors().isEmpty());
        }

        @Test
        @DisplayName("accepts paths under configured extra prefixes")
        void acceptsExtraPrefix() {
            assertTrue(resolver.validatePath("/srv/mcp/users/u1").valid());
            assertFalse(resolver.validatePath("/srv/mcpx/users").valid());
        }

        @Test
        @DisplayName("accepts relative paths and bare command names")
        void acceptsRelative() {
            assertTrue(resolver.validatePath("node").valid());
            assertTrue(resolver.validatePath("data/u1").valid());
        }

        @Test
        @DisplayName("rejects system directories")
        void rejectsSystemDirectories() {
            var result = resolver.validatePath("/etc/passwd");

            assertFalse(result.valid());
            assertTrue(result.errors().stream().anyMatch(e -> e.contains("System directory")));
            assertFalse(resolver.validatePath("/proc/self/environ").valid());
        }

        @Test
        @DisplayName("rejects directory traversal")
        void rejectsTraversal() {
            assertFalse(resolver.validatePath("../../x").valid());
            assertFalse(resolver.validatePath("/tmp/../etc/shadow").valid());
        }

        @Test
        @DisplayName("rejects doubled slashes")
        void rejectsDoubledSlash() {
            assertFalse(resolver.validatePath("/tmp//x").valid());
        }

        @Test
        @DisplayName("rejects absolute paths outside the allowed prefixes")
        void rejectsUnlistedAbsolute() {
            var result = resolver.validatePath("/opt/data");

            assertFalse(result.valid());
            assertTrue(result.errors().get(0).contains("outside allowed directories"));
        }

        @Test
        @DisplayName("rejects invalid filename characters")
        void rejectsInvalidCharacters() {
            assertFalse(resolver.validatePath("/tmp/a|b").valid());
            assertFalse(resolver.validatePath("/tmp/a*").valid());
        }

        @Test
        @DisplayName("rejects reserved device names in the final segment, case-insensitively")
        void rejectsReservedNames() {
            assertFalse(resolver.validatePath("/tmp/CON").valid());
            assertFalse(resolver.validatePath("/tmp/data/lpt1").valid());
            assertTrue(resolver.validatePath("/tmp/CONSOLE").valid());
        }

        @Test
        @DisplayName("rejects over-long paths")
        void rejectsLongPaths() {
            var result = resolver.validatePath("/tmp/" + "a".repeat(PathTemplateResolver.MAX_PATH_LENGTH));

            assertFalse(result.valid());
            assertTrue(result.errors().stream().anyMatch(e -> e.startsWith("Path too long")));
        }

        @Test
        @DisplayName("rejects null bytes")
        void rejectsNullByte() {
            var result = resolver.validatePath("/tmp/a\0b");

            assertFalse(result.valid());
            assertTrue(result.errors().contains("Null byte detected in path"));
        }

        @Test
        @DisplayName("warns on tilde and dollar without failing")
        void warnsOnTildeAndDollar() {
            var tilde = resolver.validatePath("~/data");
            var dollar = resolver.validatePath("$HOME/data");

            assertTrue(tilde.valid());
            assertEquals(1, tilde.warnings().size());
            assertTrue(dollar.valid());
            assertTrue(dollar.warnings().get(0).contains("environment variable"));
        }

        @Test
        @DisplayName("the root directory is never an allowed prefix")
        void rootIsNotAllowed() {
            var wide = new PathTemplateResolver(List.of("/"));

            assertFalse(wide.getAllowedPrefixes().contains("/"));
            assertFalse(wide.validatePath("/opt/data").valid());
        }
    }

    // -- Variables ------------------------------------------------------------

    @Nested
    @DisplayName("createVariables")
    class CreateVariables {

        @Test
        @DisplayName("derives directories and a filesystem-safe timestamp")
        void derivesAllVariables() {
            var vars = resolver.createVariables("u1", "u1@example.com", "s1", "r1",
                    Instant.parse("2026-01-15T10:30:45.123Z"));

            assertEquals("u1", vars.get("userId"));
            assertEquals("user_u1", vars.get("userDir"));
            assertEquals("u1@example.com", vars.get("userEmail"));
            assertEquals("s1", vars.get("sessionId"));
            assertEquals("session_s1", vars.get("sessionDir"));
            assertEquals("r1", vars.get("requestId"));
            assertEquals("2026-01-15T10-30-45-123Z", vars.get("timestamp"));
            assertEquals("2026-01-15", vars.get("dateDir"));
            assertEquals("10-30-45", vars.get("timeDir"));
        }

        @Test
        @DisplayName("omits variables whose source is absent")
        void omitsAbsent() {
            var vars = resolver.createVariables(CallerContext.anonymous());

            assertFalse(vars.containsKey("userId"));
            assertFalse(vars.containsKey("sessionDir"));
            assertTrue(vars.containsKey("requestId"));
            assertTrue(vars.containsKey("timestamp"));
        }

        @Test
        @DisplayName("directory variables are sanitized")
        void sanitizesDirectories() {
            var vars = resolver.createVariables("a..b", null, "x|y", null, null);

            assertEquals("user_a__b", vars.get("userDir"));
            assertEquals("session_x_y", vars.get("sessionDir"));
        }
    }

    // -- Whole configuration --------------------------------------------------

    @Nested
    @DisplayName("validateAndResolveConfig")
    class ValidateAndResolveConfig {

        private final Map<String, String> vars = Map.of("userId", "u1", "userDir", "user_u1");

        @Test
        @DisplayName("resolves every launch string of a valid definition")
        void resolvesValidDefinition() {
            var def = ServerDefinition.builder("notes", "node")
                    .lifecycle(LifecycleMode.USER)
                    .args("server.js", "--data", "/tmp/{userDir}")
                    .env("NOTES_HOME", "/tmp/{userDir}/notes")
                    .workingDirectory("/tmp/{userDir}")
                    .pathTemplate("cache", "/tmp/{userDir}/cache")
                    .build();

            var resolved = resolver.validateAndResolveConfig(LaunchTemplate.from(def), vars);

            assertTrue(resolved.validation().valid(), resolved.validation().errors().toString());
            assertEquals("node", resolved.config().command());
            assertEquals(List.of("server.js", "--data", "/tmp/user_u1"), resolved.config().args());
            assertEquals("/tmp/user_u1/notes", resolved.config().env().get("NOTES_HOME"));
            assertEquals("/tmp/user_u1", resolved.config().workingDirectory());
            assertEquals("/tmp/user_u1/cache", resolved.config().pathTemplates().get("cache"));
        }

        @Test
        @DisplayName("reports unresolved placeholders as errors")
        void reportsUnresolved() {
            var def = ServerDefinition.builder("scratch", "node")
                    .workingDirectory("/tmp/{sessionDir}")
                    .build();

            var resolved = resolver.validateAndResolveConfig(LaunchTemplate.from(def), vars);

            assertFalse(resolved.validation().valid());
            assertTrue(resolved.validation().errors()
                    .contains("Unresolved template variable '{sessionDir}' in workingDirectory"));
        }

        @Test
        @DisplayName("names the offending path template")
        void namesInvalidPathTemplate() {
            var def = ServerDefinition.builder("files", "node")
                    .pathTemplate("secrets", "/etc/{userId}")
                    .build();

            var resolved = resolver.validateAndResolveConfig(LaunchTemplate.from(def), vars);

            assertFalse(resolved.validation().valid());
            assertTrue(resolved.validation().errors().get(0).startsWith("Invalid path template 'secrets'"));
        }

        @Test
        @DisplayName("rejects a command outside the allowed directories")
        void rejectsCommand() {
            var def = ServerDefinition.builder("files", "/opt/bin/server").build();

            assertFalse(resolver.validateAndResolveConfig(LaunchTemplate.from(def), vars).validation().valid());
        }

        @Test
        @DisplayName("collects warnings without failing")
        void collectsWarnings() {
            var def = ServerDefinition.builder("files", "node")
                    .workingDirectory("~/work")
                    .build();

            var resolved = resolver.validateAndResolveConfig(LaunchTemplate.from(def), vars);

            assertTrue(resolved.validation().valid());
            assertFalse(resolved.validation().warnings().isEmpty());
        }
    }
}
