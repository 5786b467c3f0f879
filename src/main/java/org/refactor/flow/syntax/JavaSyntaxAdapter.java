package org.refactor.flow.syntax;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.*;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.*;

import java.util.Optional;

import static org.refactor.flow.syntax.SyntaxKind.*;

/**
 * 把 JavaParser 的 AST 转成 {@link SyntaxTree}
 * <p>
 * 转换规则：
 * - 方法 / 构造器 → FUNCTION[IDENTIFIER 名字, PARAMETER..., BLOCK]
 * - if → IF[CONDITION, then, ELSE?]
 * - while / do / for / foreach → LOOP[CONDITION, body]，for 的初始化提到循环前，更新语句放到循环体末尾
 * - return / throw → RETURN
 * - try → TRY[资源声明..., BLOCK, HANDLER..., FINALLY?]
 * - switch → SWITCH[CONDITION, CASE...]
 * - 其它无法识别的语句 → OTHER
 */
public class JavaSyntaxAdapter {

    private final SyntaxTree tree = new SyntaxTree();

    private JavaSyntaxAdapter() {
    }

    public static JavaParser newParser() {
        return new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    public static SyntaxTree parseCompilationUnit(String code) {
        return fromCompilationUnit(unwrap(newParser().parse(code)));
    }

    public static SyntaxTree parseMethod(String code) {
        return fromMethod(unwrap(newParser().parseMethodDeclaration(code)));
    }

    /**
     * 解析一个语句块，例如 "{ int a = 1; a++; }"
     */
    public static SyntaxTree parseBlock(String code) {
        return fromBlock(unwrap(newParser().parseBlock(code)));
    }

    public static SyntaxTree fromCompilationUnit(CompilationUnit cu) {
        JavaSyntaxAdapter adapter = new JavaSyntaxAdapter();
        SyntaxNode unit = adapter.create(UNIT, cu, null);
        cu.getTypes().forEach(type -> adapter.type(type, unit));
        return adapter.tree;
    }

    public static SyntaxTree fromMethod(MethodDeclaration md) {
        JavaSyntaxAdapter adapter = new JavaSyntaxAdapter();
        adapter.function(md, md.getBody(), null);
        return adapter.tree;
    }

    public static SyntaxTree fromConstructor(ConstructorDeclaration cd) {
        JavaSyntaxAdapter adapter = new JavaSyntaxAdapter();
        adapter.function(cd, Optional.of(cd.getBody()), null);
        return adapter.tree;
    }

    public static SyntaxTree fromBlock(BlockStmt block) {
        JavaSyntaxAdapter adapter = new JavaSyntaxAdapter();
        adapter.statement(block, null);
        return adapter.tree;
    }

    private static <T extends Node> T unwrap(ParseResult<T> result) {
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }
        throw new ParseProblemException(result.getProblems());
    }

    // ---------------------------------------------------------------- 声明

    private void type(TypeDeclaration<?> type, SyntaxNode parent) {
        SyntaxNode node = create(TYPE, type, parent);
        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof MethodDeclaration md) {
                function(md, md.getBody(), node);
            } else if (member instanceof ConstructorDeclaration cd) {
                function(cd, Optional.of(cd.getBody()), node);
            } else if (member instanceof FieldDeclaration fd) {
                SyntaxNode decl = create(DECLARATION, fd, node);
                fd.getVariables().forEach(v -> declarator(v, decl));
            } else if (member instanceof InitializerDeclaration init) {
                statement(init.getBody(), node);
            } else if (member instanceof TypeDeclaration<?> nested) {
                type(nested, node);
            }
            // 注解成员、枚举常量等不参与控制流
        }
    }

    private void function(CallableDeclaration<?> callable, Optional<BlockStmt> body, SyntaxNode parent) {
        SyntaxNode fn = create(FUNCTION, callable, parent);
        create(IDENTIFIER, callable.getName(), fn);
        callable.getParameters().forEach(p -> parameter(p, fn));
        body.ifPresent(b -> statement(b, fn));
    }

    private void parameter(Parameter parameter, SyntaxNode parent) {
        SyntaxNode node = create(PARAMETER, parameter, parent);
        create(IDENTIFIER, parameter.getName(), node);
    }

    private void declarator(VariableDeclarator vd, SyntaxNode parent) {
        SyntaxNode node = create(DECLARATOR, vd, parent);
        create(IDENTIFIER, vd.getName(), node);
        vd.getInitializer().ifPresent(init -> expression(init, node));
    }

    // ---------------------------------------------------------------- 语句

    private void statement(Statement s, SyntaxNode parent) {
        if (s instanceof BlockStmt block) {
            SyntaxNode node = create(BLOCK, s, parent);
            block.getStatements().forEach(child -> statement(child, node));
        } else if (s instanceof IfStmt ifStmt) {
            SyntaxNode node = create(IF, s, parent);
            condition(ifStmt.getCondition(), node);
            statement(ifStmt.getThenStmt(), node);
            ifStmt.getElseStmt().ifPresent(elseStmt -> {
                SyntaxNode elseNode = create(ELSE, elseStmt, node);
                statement(elseStmt, elseNode);
            });
        } else if (s instanceof WhileStmt whileStmt) {
            SyntaxNode node = create(LOOP, s, parent);
            condition(whileStmt.getCondition(), node);
            statement(whileStmt.getBody(), node);
        } else if (s instanceof DoStmt doStmt) {
            // do-while 同样以循环头开始，近似处理
            SyntaxNode node = create(LOOP, s, parent);
            condition(doStmt.getCondition(), node);
            statement(doStmt.getBody(), node);
        } else if (s instanceof ForStmt forStmt) {
            forLoop(forStmt, parent);
        } else if (s instanceof ForEachStmt forEach) {
            forEachLoop(forEach, parent);
        } else if (s instanceof ReturnStmt returnStmt) {
            SyntaxNode node = create(RETURN, s, parent);
            returnStmt.getExpression().ifPresent(e -> expression(e, node));
        } else if (s instanceof ThrowStmt throwStmt) {
            SyntaxNode node = create(RETURN, s, parent);
            expression(throwStmt.getExpression(), node);
        } else if (s instanceof BreakStmt) {
            create(BREAK, s, parent);
        } else if (s instanceof ContinueStmt) {
            create(CONTINUE, s, parent);
        } else if (s instanceof TryStmt tryStmt) {
            tryStatement(tryStmt, parent);
        } else if (s instanceof SwitchStmt switchStmt) {
            SyntaxNode node = create(SWITCH, s, parent);
            condition(switchStmt.getSelector(), node);
            for (SwitchEntry entry : switchStmt.getEntries()) {
                SyntaxNode caseNode = create(entry.getLabels().isEmpty() ? DEFAULT_CASE : CASE, entry, node);
                entry.getStatements().forEach(child -> statement(child, caseNode));
            }
        } else if (s instanceof ExpressionStmt exprStmt) {
            simpleStatement(exprStmt.getExpression(), s, parent);
        } else if (s instanceof LocalClassDeclarationStmt local) {
            type(local.getClassDeclaration(), parent);
        } else if (s instanceof LocalRecordDeclarationStmt local) {
            type(local.getRecordDeclaration(), parent);
        } else if (s instanceof EmptyStmt) {
            // 空语句
        } else {
            // labeled / synchronized / assert 等：交给通用规则
            SyntaxNode node = create(OTHER, s, parent);
            for (Node child : s.getChildNodes()) {
                if (child instanceof Statement cs) {
                    statement(cs, node);
                } else if (child instanceof Expression ce) {
                    expression(ce, node);
                }
            }
        }
    }

    private void forLoop(ForStmt forStmt, SyntaxNode parent) {
        SyntaxNode owner = parent;
        if (!forStmt.getInitialization().isEmpty()) {
            owner = create(BLOCK, forStmt, parent);
            for (Expression init : forStmt.getInitialization()) {
                simpleStatement(init, init, owner);
            }
        }
        SyntaxNode loop = create(LOOP, forStmt, owner);
        if (forStmt.getCompare().isPresent()) {
            condition(forStmt.getCompare().get(), loop);
        } else {
            int line = line(forStmt.getBegin());
            tree.createNode(CONDITION, "true", line, line, loop);
        }
        SyntaxNode body = loop;
        if (!forStmt.getUpdate().isEmpty()) {
            body = create(BLOCK, forStmt.getBody(), loop);
        }
        statement(forStmt.getBody(), body);
        for (Expression update : forStmt.getUpdate()) {
            simpleStatement(update, update, body);
        }
    }

    private void forEachLoop(ForEachStmt forEach, SyntaxNode parent) {
        SyntaxNode loop = create(LOOP, forEach, parent);
        VariableDeclarationExpr variable = forEach.getVariable();
        SyntaxNode cond = tree.createNode(CONDITION,
                textOf(variable) + " : " + textOf(forEach.getIterable()),
                line(variable.getBegin()), line(forEach.getIterable().getEnd()), loop);
        variable.getVariables().forEach(v -> declarator(v, cond));
        expression(forEach.getIterable(), cond);
        statement(forEach.getBody(), loop);
    }

    private void tryStatement(TryStmt tryStmt, SyntaxNode parent) {
        SyntaxNode node = create(TRY, tryStmt, parent);
        for (Expression resource : tryStmt.getResources()) {
            simpleStatement(resource, resource, node);
        }
        statement(tryStmt.getTryBlock(), node);
        for (CatchClause clause : tryStmt.getCatchClauses()) {
            SyntaxNode handler = create(HANDLER, clause, node);
            parameter(clause.getParameter(), handler);
            statement(clause.getBody(), handler);
        }
        tryStmt.getFinallyBlock().ifPresent(block -> {
            SyntaxNode cleanup = create(FINALLY, block, node);
            statement(block, cleanup);
        });
    }

    private void simpleStatement(Expression e, Node source, SyntaxNode parent) {
        if (e instanceof VariableDeclarationExpr decl) {
            SyntaxNode node = create(DECLARATION, source, parent);
            decl.getVariables().forEach(v -> declarator(v, node));
        } else {
            SyntaxNode node = create(STATEMENT, source, parent);
            expression(e, node);
        }
    }

    // ---------------------------------------------------------------- 表达式

    private void condition(Expression e, SyntaxNode parent) {
        SyntaxNode node = create(CONDITION, e, parent);
        expression(e, node);
    }

    private void expression(Expression e, SyntaxNode parent) {
        if (e instanceof NameExpr name) {
            create(isTypeReference(name) ? TYPE_NAME : IDENTIFIER, name, parent);
        } else if (e instanceof AssignExpr assign) {
            SyntaxKind kind = assign.getOperator() == AssignExpr.Operator.ASSIGN ? ASSIGNMENT : UPDATE;
            SyntaxNode node = create(kind, e, parent);
            expression(assign.getTarget(), node);
            expression(assign.getValue(), node);
        } else if (e instanceof UnaryExpr unary && isIncrementOrDecrement(unary.getOperator())) {
            SyntaxNode node = create(UPDATE, e, parent);
            expression(unary.getExpression(), node);
        } else if (e instanceof VariableDeclarationExpr decl) {
            SyntaxNode node = create(EXPRESSION, e, parent);
            decl.getVariables().forEach(v -> declarator(v, node));
        } else if (e instanceof LiteralExpr) {
            create(LITERAL, e, parent);
        } else if (e instanceof MethodCallExpr call) {
            SyntaxNode node = create(CALL, e, parent);
            call.getScope().ifPresent(scope -> expression(scope, node));
            call.getArguments().forEach(arg -> expression(arg, node));
        } else if (e instanceof LambdaExpr lambda) {
            SyntaxNode node = create(EXPRESSION, e, parent);
            lambda.getParameters().forEach(p -> parameter(p, node));
            statement(lambda.getBody(), node);
        } else {
            // 其它表达式：只保留子表达式（名字、类型、注释等被丢弃）
            SyntaxNode node = create(EXPRESSION, e, parent);
            for (Node child : e.getChildNodes()) {
                if (child instanceof Expression ce) {
                    expression(ce, node);
                } else if (child instanceof Statement cs) {
                    statement(cs, node);
                }
            }
        }
    }

    /**
     * 形如 Math.max(..) / System.out 中首字母大写的接收者视为类型引用，而不是变量
     */
    private static boolean isTypeReference(NameExpr name) {
        String id = name.getNameAsString();
        if (id.isEmpty() || !Character.isUpperCase(id.charAt(0))) {
            return false;
        }
        Node parent = name.getParentNode().orElse(null);
        if (parent instanceof MethodCallExpr call) {
            return call.getScope().filter(scope -> scope == name).isPresent();
        }
        if (parent instanceof FieldAccessExpr access) {
            return access.getScope() == name;
        }
        return false;
    }

    private static boolean isIncrementOrDecrement(UnaryExpr.Operator op) {
        return op == UnaryExpr.Operator.PREFIX_INCREMENT
                || op == UnaryExpr.Operator.PREFIX_DECREMENT
                || op == UnaryExpr.Operator.POSTFIX_INCREMENT
                || op == UnaryExpr.Operator.POSTFIX_DECREMENT;
    }

    // ---------------------------------------------------------------- 工具

    private SyntaxNode create(SyntaxKind kind, Node source, SyntaxNode parent) {
        return tree.createNode(kind, textOf(source), line(source.getBegin()), line(source.getEnd()), parent);
    }

    static String textOf(Node node) {
        return node.getTokenRange().map(TokenRange::toString).orElseGet(node::toString);
    }

    private static int line(Optional<Position> position) {
        return position.map(p -> p.line).orElse(-1);
    }
}
