package org.syntree.transform;

import org.syntree.api.SyntreeErrorCode;
import org.syntree.api.TransformationException;
import org.syntree.semantics.SymbolTableBuilder;
import org.syntree.transform.passes.ConstantFoldingPass;
import org.syntree.transform.passes.DeadCodeEliminationPass;
import org.syntree.transform.passes.ExpressionSimplificationPass;
import org.syntree.transform.passes.FunctionInliningPass;
import org.syntree.transform.passes.UnusedVariableRemovalPass;
import org.syntree.tree.TreeWalker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * A registry of pass factories by name. Each lookup creates a fresh pass instance, so
 * pipelines built from one registry never share pass state.
 */
public class PassRegistry {
    private final Map<String, Supplier<? extends TransformPass>> factories = new LinkedHashMap<>();

    /**
     * Registers a pass factory, replacing any factory of the same name.
     * @param name The pass name, e.g. {@code "constant_folding"}.
     * @param factory Creates a new pass instance on every call.
     */
    public void register(String name, Supplier<? extends TransformPass> factory) {
        factories.put(name, factory);
    }

    /**
     * Gets the factory for a given pass name.
     * @param name The pass name.
     * @return An {@link Optional} containing the factory if it exists, otherwise empty.
     */
    public Optional<Supplier<? extends TransformPass>> get(String name) {
        return Optional.ofNullable(factories.get(name));
    }

    /**
     * Creates a new instance of a registered pass.
     * @param name The pass name.
     * @return The new pass.
     * @throws TransformationException with {@link SyntreeErrorCode#PASS_UNKNOWN} if no pass has that name.
     */
    public TransformPass create(String name) {
        return get(name)
                .map(Supplier::get)
                .orElseThrow(() -> new TransformationException(SyntreeErrorCode.PASS_UNKNOWN, name,
                        "No pass registered under the name '" + name + "'", null));
    }

    /**
     * @return The registered names in registration order.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    /**
     * Creates a registry holding all built-in passes that take no parameters.
     * Variable renaming is parameterised and has to be added to pipelines directly.
     * @return A new registry.
     */
    public static PassRegistry withDefaults() {
        return withDefaults(TreeWalker.DEFAULT_MAX_DEPTH);
    }

    /**
     * Creates a registry holding all built-in parameterless passes, traversing trees up to the given depth.
     * @param maxDepth The maximum tree depth the passes accept.
     * @return A new registry.
     */
    public static PassRegistry withDefaults(int maxDepth) {
        PassRegistry registry = new PassRegistry();
        registry.register(ConstantFoldingPass.NAME, () -> new ConstantFoldingPass(new TreeWalker(maxDepth)));
        registry.register(ExpressionSimplificationPass.NAME, () -> new ExpressionSimplificationPass(new TreeWalker(maxDepth)));
        registry.register(DeadCodeEliminationPass.NAME, () -> new DeadCodeEliminationPass(new TreeWalker(maxDepth)));
        registry.register(UnusedVariableRemovalPass.NAME, () -> new UnusedVariableRemovalPass(
                new SymbolTableBuilder(Set.of(), maxDepth), new TreeWalker(maxDepth)));
        registry.register(FunctionInliningPass.NAME, () -> new FunctionInliningPass(
                new SymbolTableBuilder(Set.of(), maxDepth), new TreeWalker(maxDepth)));
        return registry;
    }
}
