package com.jsir.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsir.ast.*;
import com.jsir.json.AstJsonException;
import com.jsir.json.AstJsonProvider;
import com.jsir.transform.Transformer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    private static Position at(int line) {
        return new Position("json.js", line, 0);
    }

    /**
     * A program touching every node kind, including positions without a source name and without
     * any position at all.
     */
    private static Tree program() {
        Tree clazz = new ClassDef(at(1), new Ident(at(1), "A"), EmptyTree.INSTANCE, List.of(
            new MethodDef(at(2), new StringLiteral(at(2), "run-now"), List.of(new Ident(at(2), "n")),
                new Block(at(2), List.of(new VarDef(at(3), new Ident(at(3), "k"), new IntLiteral(at(3), Long.MAX_VALUE))),
                    new Return(at(3), new BinaryOp(at(3), "+", new Ident(at(3), "k"), new Ident(at(3), "n"))))),
            new GetterDef(at(4), new Ident(at(4), "g"), new Return(at(4), new This(at(4)))),
            new SetterDef(at(5), new Ident(at(5), "g"), new Ident(at(5), "v"), new Skip(at(5)))));

        Tree loop = new While(new Position(6, 0), new BooleanLiteral(new Position(6, 7), true),
            new If(at(7), new UnaryOp(at(7), "!", new Null(at(7))), new Break(at(7)), new Continue(at(7))));

        Tree guarded = new Try(at(8),
            new Assign(at(8), new BracketSelect(at(8), new Ident(at(8), "o"), new Ident(at(8), "i")),
                new New(at(8), new Ident(at(8), "A"), List.of())),
            new Ident(at(8), "e"),
            new Throw(at(9), new Ident(at(9), "e")),
            EmptyTree.INSTANCE);

        Tree values = new ArrayConstr(at(10), List.of(
            new DoubleLiteral(at(10), 0.1),
            new DoubleLiteral(at(10), Double.NaN),
            new DoubleLiteral(at(10), Double.NEGATIVE_INFINITY),
            new Undefined(Position.NO_POSITION),
            new ObjectConstr(at(11), List.of(
                new ObjectConstr.Field(new Ident(at(11), "x"), new StringLiteral(at(11), " quote\"")),
                new ObjectConstr.Field(new StringLiteral(at(11), "x"), new Function(at(11), List.of(),
                    new Apply(at(11), new Super(at(11)), List.of()))))),
            ApplyMethod.of(new Ident(at(12), "console"), PropertyName.of("log", at(12)), List.of(), at(12))));

        return new Block(at(0), List.of(clazz, loop, guarded, new FunDef(at(13), new Ident(at(13), "f"),
            List.of(new Ident(at(13), "a"), new Ident(at(13), "b")), values)), EmptyTree.INSTANCE);
    }

    @Test
    void testProviderIsDiscovered() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider());
        assertEquals("Jackson", AstJsonProvider.getProvider("jackson").getName());
        assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("Gson"));
    }

    @Test
    void testRoundTrip() {
        AstJsonProvider provider = AstJsonProvider.getProvider();
        Tree tree = program();

        String json = provider.getSerializer().serialize(tree);
        Tree parsed = provider.getDeserializer().deserialize(json);

        assertEquals(tree, parsed);
        assertEquals(tree, provider.getDeserializer().deserialize(provider.getSerializer().serializePretty(tree)));
    }

    @Test
    void testRoundTripOfRewrittenTree() {
        AstJsonProvider provider = new JacksonAstJsonProvider();
        Tree rewritten = new Transformer().rewriteStatement(program());

        assertEquals(rewritten,
            provider.getDeserializer().deserialize(provider.getSerializer().serialize(rewritten), Block.class));
    }

    @Test
    void testJsonShape() throws Exception {
        ObjectMapper mapper = new JacksonAstJsonProvider().getObjectMapper();
        Tree tree = new If(at(4), new Ident(at(4), "c"), new Skip(Position.NO_POSITION), EmptyTree.INSTANCE);

        JsonNode json = mapper.readTree(new JacksonAstJsonProvider().getSerializer().serialize(tree));
        System.out.println("Serialized: " + json);

        assertEquals("If", json.get("type").asText());
        assertEquals("json.js", json.at("/pos/source").asText());
        assertEquals(4, json.at("/pos/line").asInt());
        assertFalse(json.get("pos").has("defined"));
        assertEquals("Ident", json.at("/cond/type").asText());
        assertEquals("c", json.at("/cond/name").asText());
        // Nodes without a position carry no pos at all
        assertEquals("Skip", json.at("/thenp/type").asText());
        assertFalse(json.get("thenp").has("pos"));
        assertEquals("EmptyTree", json.at("/elsep/type").asText());
    }

    @Test
    void testNonFiniteDoublesUseJavaScriptNames() throws Exception {
        ObjectMapper mapper = JsirJackson.createObjectMapper();

        assertEquals("\"NaN\"", mapper.readTree(mapper.writeValueAsString(new DoubleLiteral(at(1), Double.NaN))).get("value").toString());
        assertEquals("Infinity", mapper.readTree(mapper.writeValueAsString(
            new DoubleLiteral(at(1), Double.POSITIVE_INFINITY))).get("value").asText());
        assertEquals(2.5, mapper.readTree(mapper.writeValueAsString(new DoubleLiteral(at(1), 2.5))).get("value").asDouble());
    }

    @Test
    void testMissingPosMeansNoPosition() {
        Tree tree = new JacksonAstJsonProvider().getDeserializer().deserialize("""
            {
              "type": "Return",
              "expr": { "type": "IntLiteral", "value": 42 }
            }
            """);

        assertEquals(new Return(Position.NO_POSITION, new IntLiteral(Position.NO_POSITION, 42)), tree);
    }

    @Test
    void testInvalidIdentifierIsReported() {
        String json = "{\"type\": \"Ident\", \"name\": \"3bad\"}";

        AstJsonException e = assertThrows(AstJsonException.class,
            () -> new JacksonAstJsonProvider().getDeserializer().deserialize(json));

        Throwable cause = e;
        while (cause != null && !(cause instanceof InvalidIdentifierException)) {
            cause = cause.getCause();
        }
        assertNotNull(cause, "InvalidIdentifierException should be in the cause chain");
        assertEquals("3bad", ((InvalidIdentifierException) cause).name());
    }

    @Test
    void testMissingChildIsReported() {
        AstJsonException e = assertThrows(AstJsonException.class,
            () -> new JacksonAstJsonProvider().getDeserializer().deserialize("{\"type\": \"Return\"}"));

        Throwable cause = e;
        while (cause != null && !(cause instanceof NullPointerException)) {
            cause = cause.getCause();
        }
        assertNotNull(cause, "NullPointerException should be in the cause chain");

        assertThrows(AstJsonException.class, () -> new JacksonAstJsonProvider().getDeserializer().deserialize("""
            {
              "type": "If",
              "cond": { "type": "This" },
              "thenp": { "type": "Skip" }
            }
            """));
    }

    @Test
    void testUnknownTypeIsReported() {
        assertThrows(AstJsonException.class,
            () -> new JacksonAstJsonProvider().getDeserializer().deserialize("{\"type\": \"Yield\"}"));
        assertThrows(AstJsonException.class,
            () -> new JacksonAstJsonProvider().getDeserializer().deserialize("not json"));
    }
}
