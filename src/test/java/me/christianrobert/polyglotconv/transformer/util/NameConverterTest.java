package me.christianrobert.polyglotconv.transformer.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NameConverterTest {

    @Test
    void camel() {
        assertEquals("GetField", NameConverter.camel("get_field"));
        assertEquals("ToIso8601", NameConverter.camel("to_iso8601"));
        assertEquals("Iso8601", NameConverter.camel("ISO8601"));
        assertEquals("Table", NameConverter.camel("table"));
        assertEquals("", NameConverter.camel(""));
        assertEquals("", NameConverter.camel(null));
    }

    @Test
    void dromedary() {
        assertEquals("getField", NameConverter.dromedary("get_field"));
        assertEquals("iso8601", NameConverter.dromedary("ISO8601"));
        assertEquals("table", NameConverter.dromedary("table"));
        assertEquals("inTimezone", NameConverter.dromedary("in_timezone"));
    }

    @Test
    void reqlMethodNames() {
        assertEquals("or", NameConverter.reqlMethodName("or_"));
        assertEquals("and", NameConverter.reqlMethodName("and_"));
        assertEquals("getField", NameConverter.reqlMethodName("get_field"));
        assertEquals("default_", NameConverter.reqlMethodName("default"));
        assertEquals("do_", NameConverter.reqlMethodName("do"));
        assertEquals("filter", NameConverter.reqlMethodName("filter"));
    }

    @Test
    void moduleNames() {
        assertEquals("Regression1133", NameConverter.moduleName("regression/1133.yaml"));
        assertEquals("MathLogicAdd", NameConverter.moduleName("math_logic/add.yaml"));
        assertEquals("Arity", NameConverter.moduleName("arity"));
        assertEquals("ChangefeedsSquash", NameConverter.moduleName("changefeeds/squash.py.yaml"));
    }
}
