// file: format/src/test/java/io/sumspec/format/latex/LatexDocumentTest.java
package io.sumspec.format.latex;

import io.sumspec.core.json.PipelineLoader;
import io.sumspec.core.spec.Pipeline;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LatexDocumentTest {

    private final Pipeline pipeline = PipelineLoader.reference();

    @Test
    void document_is_complete_and_balanced() {
        String tex = LatexDocument.render(pipeline.title(), pipeline.stages());

        assertTrue(tex.startsWith("\\documentclass[11pt]{article}\n"));
        assertTrue(tex.contains("\\usepackage[dvipsnames]{xcolor}"));
        assertTrue(tex.contains("\\usepackage{booktabs}"));
        assertTrue(tex.contains("\\begin{document}"));
        assertTrue(tex.endsWith("\\end{document}\n"));
        assertTrue(tex.contains("\\section{Stage 2 --- Virtualization \\& RAM}"));
        assertTrue(tex.contains("\\subsection{SpartanOuter}"));
        assertEquals(count(tex, "\\begin{itemize}"), count(tex, "\\end{itemize}"));
        assertEquals(count(tex, "\\begin{tabular}"), count(tex, "\\end{tabular}"));
        assertEquals(count(tex, "\\["), count(tex, "\\]"));
    }

    @Test
    void sumcheck_section_has_description_and_tables() {
        String tex = LatexDocument.sumcheck(pipeline.sumcheck("SpartanOuter"));

        assertTrue(tex.contains("  \\item[Degree] 3\n"));
        assertTrue(tex.contains("  \\item[Opening point] $(r_{\\text{cycle}}^{(1)})$\n"));
        assertTrue(tex.contains("\\texttt{RamAddrZeroIfNotLoadStore}"));
        assertTrue(tex.contains("\\paragraph{Openings produced}"));
    }

    @Test
    void stage_selection_and_determinism() {
        String one = LatexDocument.render("t", pipeline.select(Set.of(3)));

        assertTrue(one.contains("\\section{Stage 3 --- "));
        assertFalse(one.contains("\\section{Stage 1 --- "));
        assertEquals(one, LatexDocument.render("t", pipeline.select(Set.of(3))));
    }

    private static int count(String s, String needle) {
        int n = 0;
        for (int i = s.indexOf(needle); i >= 0; i = s.indexOf(needle, i + needle.length())) n++;
        return n;
    }
}
