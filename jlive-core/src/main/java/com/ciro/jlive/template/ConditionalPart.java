package com.ciro.jlive.template;

import com.ciro.jlive.expr.Deps;
import com.ciro.jlive.rendered.Dynamic;
import com.ciro.jlive.rendered.Rendered;

/**
 * {@code <%= if cond do %> ... <% else %> ... <% end %>}. Cada rama es su propia
 * plantilla con su propio fingerprint; cambiar de rama reemplaza el sub-árbol.
 */
public record ConditionalPart(CompiledExpr condition, CompiledTemplate then, CompiledTemplate otherwise, Deps deps)
        implements Part {

    public static ConditionalPart of(CompiledExpr condition, CompiledTemplate then, CompiledTemplate otherwise) {
        return new ConditionalPart(condition, then, otherwise,
                condition.deps().union(then.deps()).union(otherwise.deps()));
    }

    @Override
    public Dynamic render(EvalContext ctx, Dynamic previous, int index) {
        boolean truthy = ctx.test(condition);
        CompiledTemplate branch = truthy ? then : otherwise;

        Rendered prev = null;
        if (previous instanceof Dynamic.Nested n && n.rendered().origin() == branch) {
            prev = n.rendered();
        }
        EvalContext branchCtx = ctx.withPath(ctx.path() + "/" + index + (truthy ? "t" : "f"));
        Rendered r = branch.render(branchCtx, prev);
        return r == prev ? previous : new Dynamic.Nested(r);
    }
}
