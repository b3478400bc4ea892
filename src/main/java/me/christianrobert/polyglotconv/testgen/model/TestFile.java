package me.christianrobert.polyglotconv.testgen.model;

import me.christianrobert.polyglotconv.transformer.util.NameConverter;

import java.util.Arrays;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A parsed test file: its relative name (e.g. {@code regression/1133.yaml}), description,
 * table variable names and item sequence.
 *
 * <p>The items are consumed lazily, once.</p>
 */
public class TestFile {

    private static final Pattern VARIABLE_NAME_SEPARATOR = Pattern.compile("[, ]+");
    private static final String DEFAULT_DESCRIPTION = "No description";

    private final String filename;
    private final String description;
    private final Set<String> tableVariableNames;
    private final Iterable<? extends TestItem> items;

    public TestFile(String filename, String description, Set<String> tableVariableNames,
                    Iterable<? extends TestItem> items) {
        this.filename = Objects.requireNonNull(filename, "filename");
        this.description = description != null ? description : DEFAULT_DESCRIPTION;
        this.tableVariableNames = tableVariableNames != null
                ? Collections.unmodifiableSet(new TreeSet<>(tableVariableNames))
                : Collections.emptySet();
        this.items = Objects.requireNonNull(items, "items");
    }

    /**
     * Creates a test file from the raw {@code table_variable_name} value, which lists names
     * separated by spaces and/or commas ({@code "tbl, tbl2"}).
     */
    public static TestFile of(String filename, String description, String rawTableVariableNames,
                              Iterable<? extends TestItem> items) {
        return new TestFile(filename, description, parseTableVariableNames(rawTableVariableNames), items);
    }

    public static Set<String> parseTableVariableNames(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return Collections.emptySet();
        }
        return Arrays.stream(VARIABLE_NAME_SEPARATOR.split(raw.trim()))
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public String getFilename() {
        return filename;
    }

    /**
     * Name of the generated test class ({@code regression/1133.yaml -> Regression1133}).
     */
    public String getModuleName() {
        return NameConverter.moduleName(filename);
    }

    public String getDescription() {
        return description;
    }

    /**
     * Table variable names, sorted.
     */
    public Set<String> getTableVariableNames() {
        return tableVariableNames;
    }

    public Iterable<? extends TestItem> getItems() {
        return items;
    }

    @Override
    public String toString() {
        return "TestFile{filename='" + filename + "', tableVariableNames=" + tableVariableNames + "}";
    }
}
