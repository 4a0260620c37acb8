package com.structds.core.extractor.python;

import com.structds.parser.Python3BaseListener;
import com.structds.parser.Python3Parser;
import org.antlr.v4.runtime.tree.ParseTreeWalker;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rewrites source text without parameter annotations, return annotations and the annotations of
 * annotated assignments. Everything else, comments and layout included, is kept as written.
 */
final class TypeAnnotationRemover extends Python3BaseListener {

    private final List<int[]> removals = new ArrayList<>();

    static String strip(PythonSyntaxTree tree) {
        TypeAnnotationRemover remover = new TypeAnnotationRemover();
        ParseTreeWalker.DEFAULT.walk(remover, tree.root());
        return remover.rewrite(tree);
    }

    @Override
    public void exitTfpdef(Python3Parser.TfpdefContext ctx) {
        if (ctx.test() != null || ctx.star_expr() != null) {
            removals.add(new int[] {ctx.name().getStop().getStopIndex() + 1, ctx.getStop().getStopIndex()});
        }
    }

    @Override
    public void exitFuncdef(Python3Parser.FuncdefContext ctx) {
        if (ctx.test() != null) {
            removals.add(new int[] {ctx.parameters().getStop().getStopIndex() + 1, ctx.test().getStop().getStopIndex()});
        }
    }

    @Override
    public void exitExpr_stmt(Python3Parser.Expr_stmtContext ctx) {
        Python3Parser.AnnassignContext annotation = ctx.annassign();
        if (annotation != null) {
            removals.add(new int[] {ctx.testlist_star_expr(0).getStop().getStopIndex() + 1,
                annotation.test().getStop().getStopIndex()});
        }
    }

    private String rewrite(PythonSyntaxTree tree) {
        removals.sort(Comparator.comparingInt(range -> range[0]));
        StringBuilder result = new StringBuilder();
        int position = 0;
        for (int[] range : removals) {
            if (range[0] < position) {
                continue;
            }
            result.append(tree.text(position, range[0] - 1));
            position = range[1] + 1;
        }
        result.append(tree.text(position, tree.length() - 1));
        return result.toString();
    }
}
