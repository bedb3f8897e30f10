package com.ciro.jlive.ast;

/**
 * Destino de una invocación de componente.
 * Local ({@code <.card>}): module == null, se resuelve contra la unidad que compila.
 * Remoto ({@code <Ui.card>}): module = "Ui".
 */
public record ComponentTarget(String module, String function) {

    public boolean isLocal() {
        return module == null;
    }

    public ComponentTarget resolve(String currentModule) {
        return isLocal() ? new ComponentTarget(currentModule, function) : this;
    }

    @Override
    public String toString() {
        return isLocal() ? "." + function : module + "." + function;
    }
}
