package me.golemcore.council.domain.pattern.debate;

import me.golemcore.council.domain.model.DebatePhase;
import me.golemcore.council.domain.model.Skill;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SkillPromptBuilderTest {

    private static Skill skill(String name, Map<String, Object> frontmatter) {
        return Skill.builder()
                .name(name)
                .description("Checks <things> & stuff")
                .instructions("Step 1. Do it.")
                .frontmatter(frontmatter)
                .location(Path.of("/skills", name, "SKILL.md"))
                .build();
    }

    @Test
    void shouldReturnEmptyStringWithoutSkills() {
        assertEquals("", SkillPromptBuilder.build(List.of(), DebatePhase.INITIAL));
    }

    @Test
    void shouldRenderPhaseDiscoveryAndContents() {
        String block = SkillPromptBuilder.build(
                List.of(skill("security-review", Map.of("name", "security-review", "license", "MIT"))),
                DebatePhase.REBUTTAL);

        assertTrue(block.startsWith("<skills_context>\n<activation-phase>rebuttal</activation-phase>\n"));
        assertTrue(block.contains("<purpose>Apply these skills while critiquing other positions</purpose>"));
        assertTrue(block.contains("<description>\nChecks &lt;things&gt; &amp; stuff\n</description>"));
        assertTrue(block.contains("[security-review]\n---\nname: security-review\n"));
        assertTrue(block.contains("license: MIT\n---\n\nStep 1. Do it."));
        assertFalse(block.contains("compatibility:"));
        assertTrue(block.endsWith("</activated_skill_contents>"));
    }

    @Test
    void shouldSeparateActivatedSkills() {
        String block = SkillPromptBuilder.build(List.of(skill("one", Map.of()), skill("two", Map.of())),
                DebatePhase.INITIAL);

        assertTrue(block.contains("Step 1. Do it.\n\n---\n\n[two]"));
    }
}
