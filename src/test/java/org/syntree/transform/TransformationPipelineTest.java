package org.syntree.transform;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.syntree.api.StructuralInvariantViolationException;
import org.syntree.api.SyntreeErrorCode;
import org.syntree.api.TransformationException;
import org.syntree.junit.extensions.logging.AllowLog;
import org.syntree.junit.extensions.logging.ExpectLog;
import org.syntree.junit.extensions.logging.FailOnLog;
import org.syntree.junit.extensions.logging.LogLevel;
import org.syntree.junit.extensions.logging.LogWatchExtension;
import org.syntree.transform.passes.ConstantFoldingPass;
import org.syntree.transform.passes.VariableRenamingPass;
import org.syntree.tree.AstNode;
import org.syntree.tree.NameNode;
import org.syntree.tree.ProgramNode;
import org.syntree.tree.TreeValidator;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.syntree.tree.Trees.*;

/**
 * Tests pass sequencing, validation between passes and how failures abort the pipeline.
 * Any INFO or higher event other than the summary line fails a test.
 */
@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
@FailOnLog(level = LogLevel.INFO)
@AllowLog(level = LogLevel.INFO, loggerPattern = ".*TransformationPipeline", messagePattern = "Pipeline finished.*")
class TransformationPipelineTest {

    @Mock
    private TransformPass first;

    @Mock
    private TransformPass second;

    @Test
    void passesRunInOrderOnThePreviousOutput() {
        // Arrange
        ProgramNode input = program(expr(name("a")));
        ProgramNode afterFirst = program(expr(name("b")));
        ProgramNode afterSecond = program(expr(name("c")));
        when(first.name()).thenReturn("first");
        when(second.name()).thenReturn("second");
        when(first.transform(input)).thenReturn(afterFirst);
        when(second.transform(afterFirst)).thenReturn(afterSecond);

        // Act
        AstNode result = TransformationPipeline.pipeline(first, second).run(input);

        // Assert
        assertThat(result).isSameAs(afterSecond);
        InOrder order = inOrder(first, second);
        order.verify(first).transform(input);
        order.verify(second).transform(afterFirst);
    }

    @Test
    void emptyPipelineReturnsInput() {
        ProgramNode input = program(expr(name("a")));

        assertThat(new TransformationPipeline().run(input)).isSameAs(input);
    }

    @Test
    void inputTreeIsNotModified() {
        ProgramNode input = program(assign("x", binOp(constant(1), "+", constant(2))), expr(name("x")));
        ProgramNode snapshot = program(assign("x", binOp(constant(1), "+", constant(2))), expr(name("x")));

        AstNode result = TransformationPipeline.pipeline(new ConstantFoldingPass(), new VariableRenamingPass("x", "y"))
                .run(input);

        assertThat(input).isEqualTo(snapshot);
        assertThat(result).isEqualTo(program(assign("y", constant(3)), expr(name("y"))));
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Rejected input tree.*")
    void invalidInputIsRejectedBeforeAnyPass() {
        NameNode shared = name("x");
        ProgramNode input = program(expr(shared), expr(shared));

        assertThatThrownBy(() -> TransformationPipeline.pipeline(first).run(input))
                .isInstanceOf(StructuralInvariantViolationException.class)
                .extracting(e -> ((StructuralInvariantViolationException) e).getCode())
                .isEqualTo(SyntreeErrorCode.TREE_SHARED_NODE);
        verify(first, never()).transform(any());
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Pass 'sharer' produced an invalid tree.*")
    void passProducingSharedNodeAbortsNamingThePass() {
        ProgramNode input = program(expr(name("a")));
        NameNode shared = name("s");
        when(first.name()).thenReturn("sharer");
        when(first.transform(input)).thenReturn(program(expr(shared), expr(shared)));

        assertThatThrownBy(() -> TransformationPipeline.pipeline(first, second).run(input))
                .isInstanceOf(StructuralInvariantViolationException.class)
                .hasMessageContaining("sharer")
                .extracting(e -> ((StructuralInvariantViolationException) e).getCode())
                .isEqualTo(SyntreeErrorCode.TREE_SHARED_NODE);
        verify(second, never()).transform(any());
    }

    @Test
    void validationBetweenPassesCanBeDisabled() {
        ProgramNode input = program(expr(name("a")));
        NameNode shared = name("s");
        ProgramNode sharing = program(expr(shared), expr(shared));
        when(first.name()).thenReturn("sharer");
        when(first.transform(input)).thenReturn(sharing);

        TransformationPipeline pipeline = new TransformationPipeline(new TreeValidator(), false).addPass(first);

        assertThat(pipeline.run(input)).isSameAs(sharing);
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Pass 'nothing' produced an invalid tree.*")
    void passReturningNullAborts() {
        ProgramNode input = program(expr(name("a")));
        when(first.name()).thenReturn("nothing");
        when(first.transform(input)).thenReturn(null);

        assertThatThrownBy(() -> TransformationPipeline.pipeline(first).run(input))
                .isInstanceOf(StructuralInvariantViolationException.class)
                .hasMessageContaining("nothing");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Pass 'broken' failed")
    void runtimeFailureIsWrappedWithPassName() {
        ProgramNode input = program(expr(name("a")));
        IllegalStateException failure = new IllegalStateException("boom");
        when(first.name()).thenReturn("broken");
        when(first.transform(input)).thenThrow(failure);

        assertThatThrownBy(() -> TransformationPipeline.pipeline(first).run(input))
                .isInstanceOfSatisfying(TransformationException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(SyntreeErrorCode.PASS_FAILED);
                    assertThat(e.getPassName()).isEqualTo("broken");
                    assertThat(e.getCause()).isSameAs(failure);
                });
    }

    @Test
    void passesCanBeLookedUpRemovedAndCleared() {
        TransformationPipeline pipeline = TransformationPipeline.pipeline(
                new ConstantFoldingPass(), new VariableRenamingPass("a", "b"));

        assertThat(pipeline.getPass(ConstantFoldingPass.NAME)).isPresent();
        assertThat(pipeline.getPass("missing")).isEmpty();

        assertThat(pipeline.removePass("rename_a_to_b")).isTrue();
        assertThat(pipeline.removePass("rename_a_to_b")).isFalse();
        assertThat(pipeline.getPasses()).extracting(TransformPass::name).containsExactly(ConstantFoldingPass.NAME);

        pipeline.clearPasses();
        assertThat(pipeline.getPasses()).isEmpty();
    }

    @Test
    void optimizeRunsTheDefaultSequence() {
        // def f():
        //     x = 2 * 3
        //     if False:
        //         g()
        //     return 1 + 0
        ProgramNode input = program(def("f", params(),
                assign("x", binOp(constant(2), "*", constant(3))),
                ifNode(constant(false), block(expr(call("g"))), block()),
                ret(binOp(name("y"), "+", constant(0)))));

        AstNode result = new TransformationPipeline().optimize(input);

        assertThat(result).isEqualTo(program(def("f", params(), ret(name("y")))));
    }

    @Test
    void pipelineFromNamesUsesRegisteredPasses() {
        TransformationPipeline pipeline = TransformationPipeline.fromNames(PassRegistry.withDefaults(),
                List.of("constant_folding", "dead_code_elimination"));

        assertThat(pipeline.getPasses()).extracting(TransformPass::name)
                .containsExactly("constant_folding", "dead_code_elimination");
    }
}
