package me.christianrobert.polyglotconv.testgen.model;

import me.christianrobert.polyglotconv.transformer.ast.CollectionNode;
import me.christianrobert.polyglotconv.transformer.ast.LiteralNode;
import me.christianrobert.polyglotconv.transformer.ast.NameNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TestFileTest {

    @Test
    void tableVariableNamesAreSplitAndSorted() {
        assertEquals(Set.of("tbl", "tbl2", "other"), TestFile.parseTableVariableNames("tbl2, tbl other"));
        assertEquals(List.of("other", "tbl", "tbl2"),
                List.copyOf(TestFile.of("a.yaml", null, "tbl2,tbl  other", List.of()).getTableVariableNames()));
        assertTrue(TestFile.parseTableVariableNames(null).isEmpty());
        assertTrue(TestFile.parseTableVariableNames("  ").isEmpty());
    }

    @Test
    void defaults() {
        TestFile file = TestFile.of("regression/1133.yaml", null, null, List.of());

        assertEquals("No description", file.getDescription());
        assertEquals("Regression1133", file.getModuleName());
        assertTrue(file.getTableVariableNames().isEmpty());
    }

    @Test
    void expectedTypeFromHostTypeName() {
        assertEquals(ExpectedType.INTEGER, ExpectedType.fromHostTypeName("int"));
        assertEquals(ExpectedType.DOUBLE, ExpectedType.fromHostTypeName("float"));
        assertEquals(ExpectedType.STRING, ExpectedType.fromHostTypeName("str"));
        assertEquals(ExpectedType.MAP, ExpectedType.fromHostTypeName("dict"));
        assertEquals(ExpectedType.LIST, ExpectedType.fromHostTypeName("list"));
        assertEquals(ExpectedType.OBJECT, ExpectedType.fromHostTypeName("NoneType"));
        assertEquals(ExpectedType.OBJECT, ExpectedType.fromHostTypeName(null));
        assertEquals("Map", ExpectedType.MAP.getJavaType());
    }

    @Test
    void expectedTypeFromExpression() {
        assertEquals(ExpectedType.INTEGER, ExpectedType.of(LiteralNode.ofInteger(1)));
        assertEquals(ExpectedType.DOUBLE, ExpectedType.of(LiteralNode.ofFloat(1.5)));
        assertEquals(ExpectedType.STRING, ExpectedType.of(LiteralNode.ofString("a")));
        assertEquals(ExpectedType.LIST, ExpectedType.of(CollectionNode.list(List.of())));
        assertEquals(ExpectedType.OBJECT, ExpectedType.of(new NameNode("err")));
    }

    @Test
    void queryDefaultsToObjectType() {
        Query query = new Query(new Term("r.expr(1)"), new Term("1"), null, "a.yaml", 1);

        assertEquals(ExpectedType.OBJECT, query.getExpectedType());
        assertTrue(query.getRunOptions().isEmpty());
        assertFalse(query.getQuery().isParsed());
    }
}
