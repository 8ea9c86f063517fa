package com.jsir.transform;

import com.jsir.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Context-aware recursive rewriter for JavaScript trees.
 *
 * <p>JavaScript distinguishes statement positions from expression positions, and several nodes
 * ({@link Block}, {@link If}, {@link While}, {@link Try}) can appear in either. The three entry points
 * rewrite a node as a statement, as an expression, or as a class member definition; each child is
 * then rewritten in the context implied by where it sits in its parent, not by the context of the
 * parent call. For instance the branches of an {@link If} are statements under
 * {@link #rewriteStatement(Tree)} but expressions under {@link #rewriteExpression(Tree)}, while its
 * condition is always an expression, and the finalizer of a {@link Try} is always a statement.</p>
 *
 * <p>The default implementation rebuilds every node with the original position and yields a tree
 * equal to its input. Passes subclass this and override the entry points, typically matching the
 * nodes they care about and delegating to {@code super} for the rest:</p>
 * <pre>{@code
 * Transformer constantsToUndefined = new Transformer() {
 *     @Override
 *     public Tree rewriteExpression(Tree tree) {
 *         if (tree instanceof IntLiteral lit) {
 *             return new Undefined(lit.pos());
 *         }
 *         return super.rewriteExpression(tree);
 *     }
 * };
 * }</pre>
 *
 * <p>Rewriting never fails: a node with no rule for the requested context is returned unchanged.
 * Recursion depth equals tree depth, so extremely deep trees (long operator chains) are bounded by
 * the thread's stack size.</p>
 */
public class Transformer {

    private static final Logger logger = LoggerFactory.getLogger(Transformer.class);

    /**
     * Rewrites {@code tree} in statement position, where any value it produces is discarded.
     */
    public Tree rewriteStatement(Tree tree) {
        Position pos = tree.pos();

        // Definitions

        if (tree instanceof VarDef varDef) {
            return new VarDef(pos, varDef.name(), rewriteExpression(varDef.rhs()));
        }
        if (tree instanceof FunDef funDef) {
            return new FunDef(pos, funDef.name(), funDef.params(), rewriteStatement(funDef.body()));
        }

        // Statement-only language constructs

        if (tree instanceof Block block) {
            return new Block(pos, rewriteStatements(block.stats()), rewriteStatement(block.expr()));
        }
        if (tree instanceof Assign assign) {
            return new Assign(pos, rewriteExpression(assign.lhs()), rewriteExpression(assign.rhs()));
        }
        if (tree instanceof Return ret) {
            return new Return(pos, rewriteExpression(ret.expr()));
        }
        if (tree instanceof If ifTree) {
            return new If(pos, rewriteExpression(ifTree.cond()),
                rewriteStatement(ifTree.thenp()), rewriteStatement(ifTree.elsep()));
        }
        if (tree instanceof While whileTree) {
            return new While(pos, rewriteExpression(whileTree.cond()), rewriteStatement(whileTree.body()));
        }
        if (tree instanceof Try tryTree) {
            return new Try(pos, rewriteStatement(tryTree.block()), tryTree.errVar(),
                rewriteStatement(tryTree.handler()), rewriteStatement(tryTree.finalizer()));
        }
        if (tree instanceof Throw throwTree) {
            return new Throw(pos, rewriteExpression(throwTree.expr()));
        }

        Tree rewritten = rewriteValueShape(tree);
        if (rewritten == null) {
            return keep(tree, "statement");
        }
        return rewritten;
    }

    /**
     * Rewrites {@code tree} in expression position, where the value it produces is used.
     */
    public Tree rewriteExpression(Tree tree) {
        Position pos = tree.pos();

        // Things that really should always be statements, but may be meaningful as expressions

        if (tree instanceof VarDef varDef) {
            return new VarDef(pos, varDef.name(), rewriteExpression(varDef.rhs()));
        }
        if (tree instanceof FunDef funDef) {
            return new FunDef(pos, funDef.name(), funDef.params(), rewriteStatement(funDef.body()));
        }
        if (tree instanceof Assign assign) {
            return new Assign(pos, rewriteExpression(assign.lhs()), rewriteExpression(assign.rhs()));
        }
        if (tree instanceof While whileTree) {
            return new While(pos, rewriteExpression(whileTree.cond()), rewriteExpression(whileTree.body()));
        }

        // Statement-only in standard JavaScript, their value flows out of the produced children

        if (tree instanceof Block block) {
            return new Block(pos, rewriteStatements(block.stats()), rewriteExpression(block.expr()));
        }
        if (tree instanceof Return ret) {
            return new Return(pos, rewriteExpression(ret.expr()));
        }
        if (tree instanceof If ifTree) {
            return new If(pos, rewriteExpression(ifTree.cond()),
                rewriteExpression(ifTree.thenp()), rewriteExpression(ifTree.elsep()));
        }
        if (tree instanceof Try tryTree) {
            return new Try(pos, rewriteExpression(tryTree.block()), tryTree.errVar(),
                rewriteExpression(tryTree.handler()), rewriteStatement(tryTree.finalizer()));
        }
        if (tree instanceof Throw throwTree) {
            return new Throw(pos, rewriteExpression(throwTree.expr()));
        }

        Tree rewritten = rewriteValueShape(tree);
        if (rewritten == null) {
            return keep(tree, "expression");
        }
        return rewritten;
    }

    /**
     * Rewrites a class member. Member bodies are statement sequences. Anything other than a
     * {@link MethodDef}, {@link GetterDef} or {@link SetterDef} is returned unchanged.
     */
    public Tree rewriteDefinition(Tree tree) {
        Position pos = tree.pos();

        if (tree instanceof MethodDef method) {
            return new MethodDef(pos, method.name(), method.params(), rewriteStatement(method.body()));
        }
        if (tree instanceof GetterDef getter) {
            return new GetterDef(pos, getter.name(), rewriteStatement(getter.body()));
        }
        if (tree instanceof SetterDef setter) {
            return new SetterDef(pos, setter.name(), setter.param(), rewriteStatement(setter.body()));
        }
        return keep(tree, "definition");
    }

    /**
     * Rules shared by both entry points: expressions, compounds and classes recurse the same way
     * wherever they appear. Returns null when {@code tree} is none of those.
     */
    private Tree rewriteValueShape(Tree tree) {
        Position pos = tree.pos();

        // Expressions

        if (tree instanceof DotSelect select) {
            return new DotSelect(pos, rewriteExpression(select.qualifier()), select.item());
        }
        if (tree instanceof BracketSelect select) {
            return new BracketSelect(pos, rewriteExpression(select.qualifier()), rewriteExpression(select.item()));
        }
        if (tree instanceof Apply apply) {
            return new Apply(pos, rewriteExpression(apply.fun()), rewriteExpressions(apply.args()));
        }
        if (tree instanceof Function function) {
            return new Function(pos, function.params(), rewriteStatement(function.body()));
        }
        if (tree instanceof UnaryOp unary) {
            return new UnaryOp(pos, unary.op(), rewriteExpression(unary.lhs()));
        }
        if (tree instanceof BinaryOp binary) {
            return new BinaryOp(pos, binary.op(), rewriteExpression(binary.lhs()), rewriteExpression(binary.rhs()));
        }
        if (tree instanceof New newTree) {
            return new New(pos, rewriteExpression(newTree.ctor()), rewriteExpressions(newTree.args()));
        }

        // Compounds

        if (tree instanceof ArrayConstr array) {
            return new ArrayConstr(pos, rewriteExpressions(array.items()));
        }
        if (tree instanceof ObjectConstr object) {
            List<ObjectConstr.Field> fields = new ArrayList<>(object.fields().size());
            for (ObjectConstr.Field field : object.fields()) {
                fields.add(new ObjectConstr.Field(field.name(), rewriteExpression(field.value())));
            }
            return new ObjectConstr(pos, fields);
        }

        // Classes

        if (tree instanceof ClassDef classDef) {
            List<Tree> defs = new ArrayList<>(classDef.defs().size());
            for (Tree def : classDef.defs()) {
                defs.add(rewriteDefinition(def));
            }
            return new ClassDef(pos, classDef.name(), rewriteExpression(classDef.parent()), defs);
        }

        return null;
    }

    private List<Tree> rewriteStatements(List<Tree> trees) {
        List<Tree> result = new ArrayList<>(trees.size());
        for (Tree tree : trees) {
            result.add(rewriteStatement(tree));
        }
        return result;
    }

    private List<Tree> rewriteExpressions(List<Tree> trees) {
        List<Tree> result = new ArrayList<>(trees.size());
        for (Tree tree : trees) {
            result.add(rewriteExpression(tree));
        }
        return result;
    }

    private Tree keep(Tree tree, String context) {
        if (logger.isTraceEnabled()) {
            logger.trace("No {} rule for {} at {}, keeping it unchanged", context,
                tree.getClass().getSimpleName(), tree.pos());
        }
        return tree;
    }
}
