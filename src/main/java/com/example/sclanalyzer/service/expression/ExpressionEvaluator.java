package com.example.sclanalyzer.service.expression;

import com.example.sclanalyzer.model.LocalBinding;
import com.example.sclanalyzer.model.SclValue;
import com.example.sclanalyzer.service.expression.Expr.ExprInterface;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Вычисляет выражения SCL над локальными переменными анализа.
 * <p>
 * Ошибка разбора или вычисления никогда не пробрасывается: результатом будет "нет значения".
 * Деление на ноль даёт ±∞ (или NaN для 0/0), аномалии обнаруживает вызывающий код.
 */
@Slf4j
@Component
public class ExpressionEvaluator {

    /**
     * Вычисляет выражение.
     *
     * @param expression текст выражения (правая часть присваивания или условие)
     * @param resolver   источник значений переменных
     * @return значение или пустой Optional, если выражение не удалось вычислить
     */
    public Optional<SclValue> evaluate(String expression, VariableResolver resolver) {
        try {
            ExprInterface ast = ExpressionParser.parse(expression);
            return Optional.of(ast.accept(new Interpreter(resolver)));
        } catch (ExpressionException | ArithmeticException e) {
            log.debug("Cannot evaluate '{}': {}", expression, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Имена переменных (голые и в кавычках), на которые ссылается выражение, в порядке появления.
     */
    public List<String> referencedNames(String expression) {
        Set<String> names = new LinkedHashSet<>();
        try {
            for (Token token : new ExpressionLexer(expression).tokenize()) {
                if (token.type == TokenType.IDENTIFIER || token.type == TokenType.TAG_REFERENCE) {
                    names.add((String) token.literal);
                }
            }
        } catch (ExpressionException e) {
            log.debug("Cannot tokenize '{}': {}", expression, e.getMessage());
        }
        return new ArrayList<>(names);
    }

    private static final class Interpreter implements Expr.ExprVisitor<SclValue> {

        private final VariableResolver resolver;

        private Interpreter(VariableResolver resolver) {
            this.resolver = resolver;
        }

        @Override
        public SclValue visitLiteralExpr(Expr.Literal expr) {
            return expr.value;
        }

        @Override
        public SclValue visitReferenceExpr(Expr.Reference expr) {
            Optional<LocalBinding> binding = resolver.resolve(expr.name);
            if (binding.isEmpty()) {
                // неизвестное имя трактуется как 0, без диагностики
                return SclValue.number(0);
            }
            if (!binding.get().hasValue()) {
                throw new ExpressionException("Variable has no value: " + expr.name);
            }
            return binding.get().getValue();
        }

        @Override
        public SclValue visitUnaryExpr(Expr.Unary expr) {
            SclValue right = expr.right.accept(this);
            switch (expr.operator.type) {
                case NOT:
                    return SclValue.bool(!right.isTruthy());
                case MINUS:
                    return SclValue.number(-right.toNumber());
                case PLUS:
                    return SclValue.number(right.toNumber());
                default:
                    throw new ExpressionException("Unknown unary operator: " + expr.operator.lexeme);
            }
        }

        @Override
        public SclValue visitLogicalExpr(Expr.Logical expr) {
            boolean left = expr.left.accept(this).isTruthy();
            if (expr.operator.type == TokenType.OR) {
                return left ? SclValue.bool(true) : SclValue.bool(expr.right.accept(this).isTruthy());
            }
            return !left ? SclValue.bool(false) : SclValue.bool(expr.right.accept(this).isTruthy());
        }

        @Override
        public SclValue visitBinaryExpr(Expr.Binary expr) {
            SclValue left = expr.left.accept(this);
            SclValue right = expr.right.accept(this);

            switch (expr.operator.type) {
                case PLUS:
                    if (left.isText() || right.isText()) {
                        return SclValue.text(left.toText() + right.toText());
                    }
                    return SclValue.number(left.toNumber() + right.toNumber());
                case MINUS:
                    return SclValue.number(left.toNumber() - right.toNumber());
                case STAR:
                    return SclValue.number(left.toNumber() * right.toNumber());
                case SLASH:
                    return SclValue.number(left.toNumber() / right.toNumber());
                case MOD:
                    return SclValue.number(left.toNumber() % right.toNumber());

                case EQUAL:
                    return SclValue.bool(strictEquals(left, right));
                case NOT_EQUAL:
                case XOR:
                    return SclValue.bool(!strictEquals(left, right));

                case LESS:
                    return SclValue.bool(compare(left, right) < 0);
                case LESS_EQUAL:
                    return SclValue.bool(compare(left, right) <= 0);
                case GREATER:
                    return SclValue.bool(compare(left, right) > 0);
                case GREATER_EQUAL:
                    return SclValue.bool(compare(left, right) >= 0);

                default:
                    throw new ExpressionException("Unknown binary operator: " + expr.operator.lexeme);
            }
        }

        /**
         * Значения разных видов никогда не равны; NaN не равен ничему.
         */
        private boolean strictEquals(SclValue left, SclValue right) {
            if (left.getKind() != right.getKind()) {
                return false;
            }
            switch (left.getKind()) {
                case BOOL:
                    return left.asBool() == right.asBool();
                case NUMBER:
                    return left.asNumber() == right.asNumber();
                default:
                    return left.asText().equals(right.asText());
            }
        }

        /**
         * Текст с текстом сравнивается лексикографически, остальное сравнивается как числа.
         * Сравнение с NaN всегда ложно (возвращается значение, не удовлетворяющее ни одному оператору).
         */
        private int compare(SclValue left, SclValue right) {
            if (left.isText() && right.isText()) {
                return Integer.signum(left.asText().compareTo(right.asText()));
            }
            double l = left.toNumber();
            double r = right.toNumber();
            if (Double.isNaN(l) || Double.isNaN(r)) {
                throw new ExpressionException("Comparison with NaN");
            }
            return Double.compare(l, r) == 0 ? 0 : (l < r ? -1 : 1);
        }
    }
}
