package com.jsir.ast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreeConstructionTest {

    private static final Position POS = new Position("nodes.js", 1, 0);

    private final Ident x = new Ident(POS, "x");
    private final Tree skip = new Skip(POS);

    @Test
    void testNullChildrenAreRejected() {
        NullPointerException e = assertThrows(NullPointerException.class,
            () -> new If(Position.NO_POSITION, null, skip, EmptyTree.INSTANCE));
        assertEquals("cond", e.getMessage());

        assertThrows(NullPointerException.class, () -> new Return(POS, null));
        assertThrows(NullPointerException.class, () -> new Throw(POS, null));
        assertThrows(NullPointerException.class, () -> new While(POS, x, null));
        assertThrows(NullPointerException.class, () -> new Try(POS, skip, null, skip, skip));
        assertThrows(NullPointerException.class, () -> new Try(POS, skip, x, skip, null));
        assertThrows(NullPointerException.class, () -> new VarDef(POS, x, null));
        assertThrows(NullPointerException.class, () -> new Assign(POS, null, x));
        assertThrows(NullPointerException.class, () -> new Block(POS, List.of(), null));
        assertThrows(NullPointerException.class, () -> new DotSelect(POS, x, null));
        assertThrows(NullPointerException.class, () -> new BracketSelect(POS, null, x));
        assertThrows(NullPointerException.class, () -> new UnaryOp(POS, "-", null));
        assertThrows(NullPointerException.class, () -> new BinaryOp(POS, "+", x, null));
        assertThrows(NullPointerException.class, () -> new Apply(POS, null, List.of()));
        assertThrows(NullPointerException.class, () -> new New(POS, null, List.of()));
        assertThrows(NullPointerException.class, () -> new Function(POS, List.of(), null));
        assertThrows(NullPointerException.class, () -> new FunDef(POS, null, List.of(), skip));
        assertThrows(NullPointerException.class, () -> new ClassDef(POS, x, null, List.of()));
        assertThrows(NullPointerException.class, () -> new MethodDef(POS, x, List.of(), null));
        assertThrows(NullPointerException.class, () -> new GetterDef(POS, null, skip));
        assertThrows(NullPointerException.class, () -> new SetterDef(POS, x, null, skip));
        assertThrows(NullPointerException.class, () -> new ObjectConstr.Field(x, null));
    }

    @Test
    void testNullListElementsAreRejected() {
        List<Tree> withNull = Arrays.asList(skip, null);

        assertThrows(NullPointerException.class, () -> new Block(POS, withNull, skip));
        assertThrows(NullPointerException.class, () -> new ArrayConstr(POS, withNull));
        assertThrows(NullPointerException.class, () -> new Apply(POS, x, withNull));
    }

    @Test
    void testAbsentChildrenUseEmptyTree() {
        If ifTree = new If(POS, x, skip, EmptyTree.INSTANCE);

        assertSame(EmptyTree.INSTANCE, ifTree.elsep());
        assertEquals(Position.NO_POSITION, ifTree.elsep().pos());
    }

    @Test
    void testChildListsAreCopied() {
        List<Tree> stats = new ArrayList<>(List.of(skip));
        Block block = new Block(POS, stats, EmptyTree.INSTANCE);
        stats.add(new Break(POS));

        assertEquals(List.of(skip), block.stats());
        assertThrows(UnsupportedOperationException.class, () -> block.stats().add(skip));
    }
}
