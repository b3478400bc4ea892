package me.christianrobert.polyglotconv.testgen.model;

import java.util.Objects;

/**
 * A source line and its Java translation.
 */
public class Version {

    private final String original;
    private final String java;

    public Version(String original, String java) {
        this.original = original;
        this.java = Objects.requireNonNull(java, "java");
    }

    public String getOriginal() {
        return original;
    }

    public String getJava() {
        return java;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Version version = (Version) o;
        return Objects.equals(original, version.original) && java.equals(version.java);
    }

    @Override
    public int hashCode() {
        return Objects.hash(original, java);
    }

    @Override
    public String toString() {
        return "Version{original='" + original + "', java='" + java + "'}";
    }
}
