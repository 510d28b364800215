package org.javai.vero.codegen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class FrameContextTest {

	@Test
	void rootResolvesToPage() {
		assertThat(FrameContext.root().rootExpression()).isEqualTo("page");
		assertThat(FrameContext.root().depth()).isZero();
		assertThat(FrameContext.root().ambiguous()).isFalse();
	}

	@Test
	void enteringFramesResolvesToFrameVariable() {
		FrameContext nested = FrameContext.root().enter().enter();

		assertThat(nested.depth()).isEqualTo(2);
		assertThat(nested.rootExpression()).isEqualTo("frame!");
	}

	@Test
	void enteringIsAFunctionalUpdate() {
		FrameContext root = FrameContext.root();
		root.enter();

		assertThat(root).isEqualTo(FrameContext.root());
	}

	@Test
	void mergingEqualContextsKeepsThem() {
		FrameContext inFrame = FrameContext.root().enter();

		assertThat(inFrame.merge(FrameContext.root().enter())).isEqualTo(inFrame);
		assertThat(FrameContext.root().merge(FrameContext.root())).isEqualTo(FrameContext.root());
	}

	@Test
	void mergingRootWithFrameIsAmbiguous() {
		FrameContext merged = FrameContext.root().merge(FrameContext.root().enter());

		assertThat(merged.ambiguous()).isTrue();
		assertThat(merged.rootExpression()).isEqualTo("(frame ?? page)");
	}

	@Test
	void mergingTwoFramesStaysInFrame() {
		FrameContext merged = FrameContext.root().enter().merge(FrameContext.root().enter().enter());

		assertThat(merged.ambiguous()).isFalse();
		assertThat(merged.rootExpression()).isEqualTo("frame!");
	}

	@Test
	void enteringFromAmbiguousContextIsSettled() {
		FrameContext ambiguous = FrameContext.root().unsettled();

		assertThat(ambiguous.rootExpression()).isEqualTo("(frame ?? page)");
		assertThat(ambiguous.enter().rootExpression()).isEqualTo("frame!");
	}

	@Test
	void depthCannotBeNegative() {
		assertThatThrownBy(() -> new FrameContext(-1, false))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
