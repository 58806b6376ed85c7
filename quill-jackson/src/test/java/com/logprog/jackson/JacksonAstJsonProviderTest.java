package com.logprog.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logprog.MalformedTreeException;
import com.logprog.Unparser;
import com.logprog.ast.*;
import com.logprog.json.AstJsonException;
import com.logprog.json.AstJsonProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    private final JacksonAstJsonProvider provider = new JacksonAstJsonProvider();
    private final ObjectMapper mapper = provider.getObjectMapper();

    private String render(String json) {
        return new Unparser().unparse(provider.getDeserializer().deserializeNode(json));
    }

    // ========== Discovery ==========

    @Test
    void testProviderIsDiscoveredThroughServiceLoader() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        assertEquals("Jackson", AstJsonProvider.getProvider().getName());
        assertEquals("Jackson", AstJsonProvider.getProvider("jackson").getName());
        assertEquals(List.of("Jackson"), AstJsonProvider.availableProviders());
    }

    @Test
    void testUnknownProviderNameIsRejected() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> AstJsonProvider.getProvider("gson"));
        assertTrue(e.getMessage().contains("gson"), e.getMessage());
    }

    @Test
    void testEveryVariantIsRegisteredAsSubtype() {
        assertEquals(Node.class.getPermittedSubclasses().length, AstModule.subtypes().length);
    }

    // ========== Serialization ==========

    @Test
    void testNodesAreTaggedWithTheirType() throws Exception {
        Node program = new StatementList(List.of(
            new Declaration(MetricKind.COUNTER, "hits", List.of("host")),
            new Builtin("timestamp", null),
            new Next()));

        JsonNode json = mapper.readTree(provider.getSerializer().serialize(program));
        assertEquals("StatementList", json.get("type").asText());
        JsonNode children = json.get("children");
        assertEquals("Declaration", children.get(0).get("type").asText());
        assertEquals("COUNTER", children.get(0).get("kind").asText());
        assertEquals("host", children.get(0).get("keys").get(0).asText());
        assertEquals("Builtin", children.get(1).get("type").asText());
        assertEquals("Next", children.get(2).get("type").asText());
    }

    @Test
    void testNullPropertiesAreLeftOut() throws Exception {
        assertEquals("{\"type\":\"Identifier\",\"name\":\"a\"}",
            provider.getSerializer().serialize(new Identifier("a")));
        assertEquals("{\"type\":\"Next\"}", provider.getSerializer().serialize(new Next()));

        JsonNode builtin = mapper.readTree(provider.getSerializer().serialize(new Builtin("len", null)));
        assertFalse(builtin.has("args"));
        assertFalse(builtin.has("loc"));
    }

    @Test
    void testPrettyOutputIsIndented() {
        String pretty = provider.getSerializer().serializePretty(new Regex("x"));
        assertTrue(pretty.contains("\n"), pretty);
        assertTrue(pretty.contains("\"pattern\" : \"x\""), pretty);
    }

    @Test
    void testTreeSurvivesSerialization() {
        Node program = new StatementList(SourceLocation.of(1, 0, 40), List.of(
            new Declaration(MetricKind.TIMER, "latency", List.of("path")),
            new Conditional(SourceLocation.of(2, 0, 30), new Regex("took (?P<ms>[0-9]+)ms"), List.of(
                new StatementList(List.of(
                    new BinaryExpr(
                        new IndexedExpr(new Identifier("latency"), new StringLiteral("/")),
                        Operator.ASSIGN,
                        new Builtin("int", new ExpressionList(List.of(new CaptureRef("ms"))))),
                    new UnaryExpr(Operator.NOT, new NumericExpr(-1)),
                    new Next()))))));

        String json = provider.getSerializer().serialize(program);
        StatementList parsed = provider.getDeserializer().deserializeProgram(json);
        assertEquals(program, parsed);
        assertEquals(new Unparser().unparse(program), new Unparser().unparse(parsed));
    }

    // ========== Deserialization ==========

    @Test
    @DisplayName("A JSON dump from a parser renders to program text")
    void testJsonDumpRendersToSource() {
        String json = """
            {
              "type": "StatementList",
              "children": [
                { "type": "Declaration", "kind": "counter", "name": "requests", "keys": ["code"] },
                {
                  "type": "Conditional",
                  "loc": { "start": { "line": 2, "column": 0 }, "end": { "line": 4, "column": 1 } },
                  "cond": { "type": "Regex", "pattern": "^(?P<code>[0-9]+) /" },
                  "children": [
                    {
                      "type": "StatementList",
                      "children": [
                        {
                          "type": "UnaryExpr",
                          "op": "inc",
                          "operand": {
                            "type": "IndexedExpr",
                            "lhs": { "type": "Identifier", "name": "requests" },
                            "index": { "type": "CaptureRef", "name": "code" }
                          }
                        }
                      ]
                    }
                  ]
                }
              ]
            }
            """;

        StatementList program = provider.getDeserializer().deserializeProgram(json);
        Conditional cond = (Conditional) program.children().get(1);
        assertEquals(2, cond.loc().start().line());
        assertEquals(1, cond.loc().end().column());

        String expected = """
            counter requests by code
            /^(?P<code>[0-9]+) \\// {
              requests[$code]++
            }
            """;
        assertEquals(expected, new Unparser().unparse(program));
    }

    @Test
    void testDeserializeSpecificVariant() {
        BinaryExpr expr = provider.getDeserializer().deserialize("""
            { "type": "BinaryExpr",
              "lhs": { "type": "Identifier", "name": "a" },
              "op": "PLUS",
              "rhs": { "type": "NumericExpr", "value": 3 } }
            """, BinaryExpr.class);
        assertEquals(Operator.PLUS, expr.op());
        assertEquals("a + 3", new Unparser().unparse(expr));
    }

    @Test
    void testBuiltinArgumentsAndNext() {
        assertEquals("len(s)", render("""
            { "type": "Builtin", "name": "len",
              "args": { "type": "ExpressionList", "children": [ { "type": "Identifier", "name": "s" } ] } }
            """));
        assertEquals("next", render("{ \"type\": \"Next\" }"));
    }

    @Test
    void testUnknownPropertiesAreIgnored() {
        assertEquals("x", render("{ \"type\": \"Identifier\", \"name\": \"x\", \"symbol\": { \"addr\": 4 } }"));
    }

    @Test
    @DisplayName("An unknown metric kind reads as no kind, and the declaration renders without a keyword")
    void testUnknownMetricKind() {
        Declaration decl = provider.getDeserializer().deserialize(
            "{ \"type\": \"Declaration\", \"kind\": \"summary\", \"name\": \"sizes\", \"keys\": [\"host\"] }",
            Declaration.class);
        assertNull(decl.kind());
        assertEquals("sizes by host", new Unparser().unparse(decl));
        assertEquals("gauge g", render("{ \"type\": \"Declaration\", \"kind\": \"Gauge\", \"name\": \"g\" }"));
    }

    @Test
    void testUnknownOperatorRendersNoToken() {
        assertEquals("ab", render("""
            { "type": "BinaryExpr", "op": "MOD",
              "lhs": { "type": "Identifier", "name": "a" },
              "rhs": { "type": "Identifier", "name": "b" } }
            """));
    }

    @Test
    void testUnknownNodeTypeIsMalformed() {
        AstJsonException e = assertThrows(AstJsonException.class, () -> provider.getDeserializer().deserializeNode(
            "{ \"type\": \"StatementList\", \"children\": [ { \"type\": \"WhileLoop\" } ] }"));
        assertEquals("WhileLoop", e.getNodeType());
        assertTrue(e.getMessage().startsWith("Malformed tree"), e.getMessage());
    }

    @Test
    void testMissingTypeIsMalformed() {
        assertThrows(AstJsonException.class,
            () -> provider.getDeserializer().deserializeNode("{ \"name\": \"x\" }"));
    }

    @Test
    void testProgramRootMustBeStatementList() {
        assertThrows(AstJsonException.class,
            () -> provider.getDeserializer().deserializeProgram("{ \"type\": \"Regex\", \"pattern\": \"x\" }"));
    }

    @Test
    void testFractionalNumericValueIsRejected() {
        assertThrows(AstJsonException.class,
            () -> provider.getDeserializer().deserializeNode("{ \"type\": \"NumericExpr\", \"value\": 1.9 }"));
        assertEquals("19", render("{ \"type\": \"NumericExpr\", \"value\": 19 }"));
    }

    @Test
    void testInvalidJsonIsReported() {
        AstJsonException e = assertThrows(AstJsonException.class,
            () -> provider.getDeserializer().deserializeNode("{ \"type\": "));
        assertNotNull(e.getCause());
        assertThrows(AstJsonException.class, () -> provider.getDeserializer().deserializeNode("null"));
    }

    @Test
    void testNullChildReachesUnparserAsMalformedTree() {
        Node program = provider.getDeserializer().deserializeNode(
            "{ \"type\": \"StatementList\", \"children\": [ { \"type\": \"Next\" }, null ] }");
        MalformedTreeException e = assertThrows(MalformedTreeException.class, () -> new Unparser().unparse(program));
        assertEquals("StatementList", e.getVariant());
    }
}
