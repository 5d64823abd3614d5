package com.schemagen.generator.codegen.header;

import static com.schemagen.generator.ModuleFixtures.simpleModule;
import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.schemagen.generator.model.ModuleInfo;

/**
 * Unit tests for HeaderRenderer.
 */
class HeaderRendererTest {

    private final HeaderRenderer renderer = new HeaderRenderer();

    @Test
    void testNoticeOnly() throws Exception {
        assertThat(renderer.render(simpleModule()).render("    "))
                .isEqualTo("# Code generated from Pkl module `N`. DO NOT EDIT.");
    }

    @Test
    void testDocCommentBecomesComments() throws Exception {
        ModuleInfo module = simpleModule().toBuilder()
                .docComment("Bird watching configuration.\n\n  Values are in metres.")
                .build();

        assertThat(renderer.render(module).render("    ")).isEqualTo("""
                # Code generated from Pkl module `N`. DO NOT EDIT.
                # Bird watching configuration.
                #
                # Values are in metres.""");
    }
}
