package com.structds.core.extractor.python;

import com.structds.core.extractor.ParsedSource.ClassRecord;
import com.structds.core.extractor.ParsedSource.FunctionRecord;
import com.structds.core.extractor.ParsedSource.ModuleRecord;
import com.structds.core.extractor.SourceSyntaxException;
import com.structds.core.model.FieldDescriptor;
import com.structds.core.model.Parameter;
import com.structds.core.model.ParameterKind;
import com.structds.core.signature.TypeExpressions;
import com.structds.parser.Python3Parser;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects the declaration structure from a parse tree.
 *
 * <p>Only direct children of the module body are surfaced, plus the methods declared directly in
 * those classes. Declarations nested in functions, in compound statements or in class bodies are
 * parsed but not reported.
 */
final class PythonStructureCollector {

    private final String filePath;
    private final PythonSyntaxTree tree;

    PythonStructureCollector(String filePath, PythonSyntaxTree tree) {
        this.filePath = filePath;
        this.tree = tree;
    }

    ModuleRecord collect() throws SourceSyntaxException {
        List<FunctionRecord> functions = new ArrayList<>();
        List<ClassRecord> classes = new ArrayList<>();
        for (Python3Parser.StmtContext stmt : tree.root().stmt()) {
            if (stmt.compound_stmt() != null) {
                declaration(stmt.compound_stmt(), functions, classes);
            }
        }
        return new ModuleRecord(filePath, functions, classes);
    }

    /**
     * Adds the function or class a compound statement declares. Classes are dropped when
     * {@code classes} is {@code null}.
     */
    private void declaration(Python3Parser.Compound_stmtContext compound, List<FunctionRecord> functions,
                             List<ClassRecord> classes) throws SourceSyntaxException {
        if (compound.funcdef() != null) {
            functions.add(function(compound.funcdef(), List.of(), false));
        } else if (compound.async_stmt() != null && compound.async_stmt().funcdef() != null) {
            functions.add(function(compound.async_stmt().funcdef(), List.of(), true));
        } else if (compound.classdef() != null) {
            if (classes != null) {
                classes.add(type(compound.classdef(), List.of()));
            }
        } else if (compound.decorated() != null) {
            Python3Parser.DecoratedContext decorated = compound.decorated();
            List<String> decorators = new ArrayList<>();
            for (Python3Parser.DecoratorContext decorator : decorated.decorator()) {
                decorators.add(tree.text(decorator.getStart().getStartIndex(),
                    decorator.namedexpr_test().getStop().getStopIndex()));
            }
            if (decorated.funcdef() != null) {
                functions.add(function(decorated.funcdef(), decorators, false));
            } else if (decorated.async_funcdef() != null) {
                functions.add(function(decorated.async_funcdef().funcdef(), decorators, true));
            } else if (classes != null) {
                classes.add(type(decorated.classdef(), decorators));
            }
        }
    }

    private FunctionRecord function(Python3Parser.FuncdefContext def, List<String> decorators, boolean async)
            throws SourceSyntaxException {
        Token name = def.name().getStart();
        List<Parameter> parameters = parameters(def.parameters().typedargslist());
        String returnType = def.test() != null ? tree.text(def.test()) : null;
        return new FunctionRecord(name.getText(), parameters, decorators, returnType, body(def.block()),
            def.getStart().getLine(), name.getCharPositionInLine() + 1, async);
    }

    private List<Parameter> parameters(Python3Parser.TypedargslistContext list) throws SourceSyntaxException {
        List<Parameter> parameters = new ArrayList<>();
        if (list == null) {
            return parameters;
        }
        Set<String> names = new HashSet<>();
        boolean slash = false;
        boolean star = false;
        boolean doubleStar = false;
        Token bareStar = null;

        for (Python3Parser.TypedargContext arg : list.typedarg()) {
            if (doubleStar) {
                throw error(arg.getStart(), "arguments cannot follow var-keyword argument");
            }
            if (arg.DIV() != null) {
                if (slash || star || parameters.isEmpty()) {
                    throw error(arg.getStart(), "invalid syntax");
                }
                slash = true;
                parameters.replaceAll(p -> new Parameter(p.identifier(), p.type(), p.lineNumber(),
                    p.colOffset(), ParameterKind.POSITIONAL_ONLY));
                continue;
            }
            if (arg.STAR() != null) {
                if (star) {
                    throw error(arg.getStart(), "* argument may appear only once");
                }
                star = true;
                if (arg.tfpdef() == null) {
                    bareStar = arg.getStart();
                } else {
                    parameters.add(parameter(arg.tfpdef(), ParameterKind.VAR_POSITIONAL, names));
                }
                continue;
            }
            if (arg.POWER() != null) {
                doubleStar = true;
            } else {
                bareStar = null;
            }
            ParameterKind kind = doubleStar ? ParameterKind.VAR_KEYWORD
                : star ? ParameterKind.KEYWORD_ONLY : ParameterKind.POSITIONAL;
            parameters.add(parameter(arg.tfpdef(), kind, names));
        }
        if (bareStar != null) {
            throw error(bareStar, "named arguments must follow bare *");
        }
        return parameters;
    }

    private Parameter parameter(Python3Parser.TfpdefContext def, ParameterKind kind, Set<String> names)
            throws SourceSyntaxException {
        Token name = def.name().getStart();
        if (!names.add(name.getText())) {
            throw error(name, "duplicate argument '" + name.getText() + "' in function definition");
        }
        String type = null;
        if (def.test() != null) {
            type = tree.text(def.test());
        } else if (def.star_expr() != null) {
            type = tree.text(def.star_expr());
        }
        return new Parameter(name.getText(), type, name.getLine(), name.getCharPositionInLine() + 1, kind);
    }

    /**
     * Source of a block: the inline statements of a simple suite, or everything after the header
     * line break through the last statement of an indented one.
     */
    private String body(Python3Parser.BlockContext block) {
        int stop = tree.lastSignificant(block).getStopIndex();
        if (block.simple_stmts() != null) {
            return tree.text(block.getStart().getStartIndex(), stop);
        }
        return tree.text(block.NEWLINE().getSymbol().getStopIndex() + 1, stop);
    }

    private ClassRecord type(Python3Parser.ClassdefContext def, List<String> decorators) throws SourceSyntaxException {
        List<String> bases = new ArrayList<>();
        if (def.arglist() != null) {
            for (Python3Parser.ArgumentContext argument : def.arglist().argument()) {
                // keyword arguments and unpacking are not bases
                if (argument.getChildCount() == 1) {
                    bases.add(TypeExpressions.normalize(tree.text(argument)));
                }
            }
        }

        Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
        List<FunctionRecord> methods = new ArrayList<>();
        Python3Parser.BlockContext block = def.block();
        if (block.simple_stmts() != null) {
            fields(block.simple_stmts(), fields);
        }
        for (Python3Parser.StmtContext stmt : block.stmt()) {
            if (stmt.simple_stmts() != null) {
                fields(stmt.simple_stmts(), fields);
            } else {
                declaration(stmt.compound_stmt(), methods, null);
            }
        }
        return new ClassRecord(def.name().getText(), bases, new ArrayList<>(fields.values()), methods,
            decorators, def.getStart().getLine());
    }

    /**
     * Records class-level fields of one logical line. The first binding of a name wins.
     */
    private void fields(Python3Parser.Simple_stmtsContext statements, Map<String, FieldDescriptor> fields) {
        for (Python3Parser.Simple_stmtContext statement : statements.simple_stmt()) {
            Python3Parser.Expr_stmtContext expr = statement.expr_stmt();
            if (expr == null || expr.augassign() != null) {
                continue;
            }
            if (expr.annassign() != null) {
                String target = plainName(expr.testlist_star_expr(0));
                if (target != null) {
                    String type = TypeExpressions.normalize(tree.text(expr.annassign().test()));
                    fields.putIfAbsent(target, new FieldDescriptor(target, type));
                }
                continue;
            }
            // children alternate target '=' target '=' ... value
            for (int i = 1; i < expr.getChildCount(); i++) {
                ParseTree child = expr.getChild(i);
                if (child instanceof TerminalNode
                        && ((TerminalNode) child).getSymbol().getType() == Python3Parser.ASSIGN
                        && expr.getChild(i - 1) instanceof Python3Parser.Testlist_star_exprContext) {
                    String target = plainName((Python3Parser.Testlist_star_exprContext) expr.getChild(i - 1));
                    if (target != null) {
                        fields.putIfAbsent(target, new FieldDescriptor(target, null));
                    }
                }
            }
        }
    }

    private static String plainName(Python3Parser.Testlist_star_exprContext target) {
        Token start = target.getStart();
        if (start == target.getStop() && start.getType() == Python3Parser.NAME) {
            return start.getText();
        }
        return null;
    }

    private SourceSyntaxException error(Token token, String message) {
        return new SourceSyntaxException(filePath, token.getLine(), token.getCharPositionInLine() + 1, message);
    }
}
