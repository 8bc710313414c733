package org.syntree.transform.passes;

import org.syntree.transform.TransformPass;
import org.syntree.tree.AstNode;
import org.syntree.tree.NameNode;
import org.syntree.tree.TreeWalker;

import java.util.Objects;

/**
 * Renames every identifier reference with a given name, in every context and every scope.
 * <p>
 * The rename is purely textual and only touches name nodes. Parameter lists, function and class
 * names, attribute names and imports keep their spelling, so renaming a parameter also requires
 * renaming the function signature by other means.
 */
public class VariableRenamingPass implements TransformPass {

    private final String oldName;
    private final String newName;
    private final TreeWalker walker;

    public VariableRenamingPass(String oldName, String newName) {
        this(oldName, newName, new TreeWalker());
    }

    public VariableRenamingPass(String oldName, String newName, TreeWalker walker) {
        this.oldName = Objects.requireNonNull(oldName, "oldName");
        this.newName = Objects.requireNonNull(newName, "newName");
        this.walker = walker;
    }

    @Override
    public String name() {
        return "rename_" + oldName + "_to_" + newName;
    }

    @Override
    public AstNode transform(AstNode tree) {
        if (oldName.equals(newName)) {
            return tree;
        }
        return walker.rewriteBottomUp(tree, node -> {
            if (node instanceof NameNode name && name.id().equals(oldName)) {
                return new NameNode(newName, name.ctx(), name.position());
            }
            return node;
        });
    }
}
