package co.fanki.semanticanalyzer.intent.domain.registry;

import java.util.List;
import java.util.Locale;

/**
 * Keyword tables the extractors match names against.
 *
 * <p>Ordered tables are evaluated top to bottom; where the first match
 * wins, the order of the rows decides precedence.</p>
 *
 * @param apiDecorators decorator names that mark an API endpoint
 * @param databaseMethods member call names that mark a database operation
 * @param authFunctions function names that mark authentication
 * @param validationKeywords fragments of validation function names
 * @param classRoles class name fragments and the purpose they imply
 * @param fileNameRoles file name fragments used when nothing else matched
 * @param criticalKeywords name fragments of critical values
 * @param sensitiveKeywords name fragments of sensitive values
 * @param privateKeywords name fragments of private values
 * @param databaseWriteMethods member call names that write to a store
 * @param networkClients names of HTTP client functions and objects
 * @param consoleMethods console methods treated as output
 * @param globalRoots objects whose mutation is global
 * @param filesystemModules module specifiers of filesystem APIs
 * @param nodeBuiltins Node.js built-in module names
 * @param dependencyPurposes specifier fragments and the purpose they imply
 * @param criticalDependencyKeywords specifier fragments of critical
 *        dependencies
 * @param couplingExclusions receivers not counted as coupling
 * @param commonNumbers numeric literals never reported as magic
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record KeywordRegistry(
        List<String> apiDecorators,
        List<String> databaseMethods,
        List<String> authFunctions,
        List<String> validationKeywords,
        List<KeywordLabel> classRoles,
        List<KeywordLabel> fileNameRoles,
        List<String> criticalKeywords,
        List<String> sensitiveKeywords,
        List<String> privateKeywords,
        List<String> databaseWriteMethods,
        List<String> networkClients,
        List<String> consoleMethods,
        List<String> globalRoots,
        List<String> filesystemModules,
        List<String> nodeBuiltins,
        List<KeywordLabel> dependencyPurposes,
        List<String> criticalDependencyKeywords,
        List<String> couplingExclusions,
        List<String> commonNumbers
) {

    private static final KeywordRegistry DEFAULTS = new KeywordRegistry(
            List.of("Get", "Post", "Put", "Delete", "Controller"),
            List.of("find", "save", "update", "delete", "query", "insert"),
            List.of("authenticate", "authorize", "login", "logout",
                    "verifyToken"),
            List.of("validate", "check", "verify", "assert"),
            List.of(KeywordLabel.of("Controller", "Controller"),
                    KeywordLabel.of("Service", "Service layer"),
                    KeywordLabel.of("Repository", "Data access"),
                    KeywordLabel.of("Model", "Data model")),
            List.of(KeywordLabel.of("controller", "Controller"),
                    KeywordLabel.of("service", "Service layer"),
                    KeywordLabel.of("util", "Utility function"),
                    KeywordLabel.of("test", "Test suite")),
            List.of("payment", "transfer", "balance"),
            List.of("password", "token", "secret", "key", "ssn", "credit"),
            List.of("email", "phone"),
            List.of("save", "update", "insert", "delete", "create"),
            List.of("fetch", "axios", "request", "http"),
            List.of("log", "error", "warn"),
            List.of("window", "global", "process"),
            List.of("fs", "fs/promises", "node:fs", "node:fs/promises",
                    "fs-extra"),
            List.of("fs", "path", "crypto", "http", "https", "os", "url",
                    "util", "events", "stream", "child_process", "zlib",
                    "net", "dns", "assert", "buffer", "readline",
                    "worker_threads", "cluster", "querystring", "tls",
                    "fs/promises", "timers", "perf_hooks", "v8", "vm"),
            List.of(KeywordLabel.of("express", "Web framework"),
                    KeywordLabel.of("react", "UI library"),
                    KeywordLabel.of("mongoose", "Database ORM"),
                    KeywordLabel.of("typeorm", "Database ORM"),
                    KeywordLabel.of("sequelize", "Database ORM"),
                    KeywordLabel.of("prisma", "Database ORM"),
                    KeywordLabel.of("axios", "HTTP client"),
                    KeywordLabel.of("lodash", "Utility functions"),
                    KeywordLabel.of("jsonwebtoken", "Authentication"),
                    KeywordLabel.of("passport", "Authentication"),
                    KeywordLabel.of("bcrypt", "Password hashing"),
                    KeywordLabel.of("jest", "Testing"),
                    KeywordLabel.of("mocha", "Testing"),
                    KeywordLabel.of("vitest", "Testing"),
                    KeywordLabel.of("chai", "Testing")),
            List.of("auth", "security", "payment", "database"),
            List.of("console", "Math", "JSON", "Object", "Array", "Promise"),
            List.of("0", "1", "-1", "10", "100"));

    /**
     * Creates a registry, copying every table.
     */
    public KeywordRegistry {
        apiDecorators = List.copyOf(apiDecorators);
        databaseMethods = List.copyOf(databaseMethods);
        authFunctions = List.copyOf(authFunctions);
        validationKeywords = List.copyOf(validationKeywords);
        classRoles = List.copyOf(classRoles);
        fileNameRoles = List.copyOf(fileNameRoles);
        criticalKeywords = List.copyOf(criticalKeywords);
        sensitiveKeywords = List.copyOf(sensitiveKeywords);
        privateKeywords = List.copyOf(privateKeywords);
        databaseWriteMethods = List.copyOf(databaseWriteMethods);
        networkClients = List.copyOf(networkClients);
        consoleMethods = List.copyOf(consoleMethods);
        globalRoots = List.copyOf(globalRoots);
        filesystemModules = List.copyOf(filesystemModules);
        nodeBuiltins = List.copyOf(nodeBuiltins);
        dependencyPurposes = List.copyOf(dependencyPurposes);
        criticalDependencyKeywords = List.copyOf(criticalDependencyKeywords);
        couplingExclusions = List.copyOf(couplingExclusions);
        commonNumbers = List.copyOf(commonNumbers);
    }

    /**
     * Returns the built-in tables.
     *
     * @return the default registry
     */
    public static KeywordRegistry defaults() {
        return DEFAULTS;
    }

    /**
     * Checks whether a name contains any of the given fragments,
     * ignoring case.
     *
     * @param name the name to check, may be null
     * @param fragments the fragments to look for
     * @return true if a fragment occurs in the name
     */
    public static boolean containsAny(final String name,
            final List<String> fragments) {
        if (name == null) {
            return false;
        }
        final String lower = name.toLowerCase(Locale.ROOT);
        for (final String fragment : fragments) {
            if (lower.contains(fragment.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether a table lists a name exactly. The tables are
     * immutable lists, which reject null lookups, so absent names
     * coming from dynamic or recovered code are answered here.
     *
     * @param name the name to look up, may be null
     * @param table the table to search
     * @return true if the name is non null and listed
     */
    public static boolean lists(final String name,
            final List<String> table) {
        return name != null && table.contains(name);
    }

}
