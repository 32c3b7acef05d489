package me.golemcore.council.adapter.outbound.skills;

import me.golemcore.council.domain.exception.SkillLoadException;
import me.golemcore.council.domain.model.Skill;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemSkillLoaderTest {

    @TempDir
    Path tempDir;

    private Path writeSkill(Path root, String relativeDir, String content) throws IOException {
        Path dir = root.resolve(relativeDir);
        Files.createDirectories(dir);
        Path file = dir.resolve("SKILL.md");
        Files.writeString(file, content);
        return file;
    }

    @Test
    void shouldParseFrontmatterAndInstructions() throws Exception {
        Path file = writeSkill(tempDir, "review/security-review", """
                ---
                name: security-review
                description: Reviews designs for security risks
                license: MIT
                allowed-tools: webSearch
                ---

                # Security review

                Check authentication first.
                """);
        FileSystemSkillLoader loader = new FileSystemSkillLoader(List.of(tempDir));

        Skill skill = loader.load("security-review");

        assertEquals("security-review", skill.getName());
        assertEquals("Reviews designs for security risks", skill.getDescription());
        assertEquals("# Security review\n\nCheck authentication first.", skill.getInstructions());
        assertEquals("MIT", skill.getFrontmatter().get("license"));
        assertEquals("webSearch", skill.getFrontmatter().get("allowed-tools"));
        assertEquals(file, skill.getLocation());
    }

    @Test
    void shouldPreferEarlierDirectory() throws Exception {
        Path custom = Files.createDirectories(tempDir.resolve("custom"));
        Path builtin = Files.createDirectories(tempDir.resolve("builtin"));
        writeSkill(custom, "db-expert", "---\nname: db-expert\ndescription: custom\n---\nCustom body\n");
        writeSkill(builtin, "db-expert", "---\nname: db-expert\ndescription: builtin\n---\nBuiltin body\n");
        FileSystemSkillLoader loader = new FileSystemSkillLoader(List.of(custom, builtin));

        assertEquals("custom", loader.load("db-expert").getDescription());
    }

    @Test
    void shouldUseDirectoryNameWhenFrontmatterHasNoName() throws Exception {
        writeSkill(tempDir, "naming", "---\ndescription: No name here\n---\nBody\n");

        Skill skill = new FileSystemSkillLoader(List.of(tempDir)).load("naming");

        assertEquals("naming", skill.getName());
    }

    @Test
    void shouldFailForMissingSkill() {
        FileSystemSkillLoader loader = new FileSystemSkillLoader(List.of(tempDir, tempDir.resolve("absent")));

        SkillLoadException error = assertThrows(SkillLoadException.class, () -> loader.load("unknown"));

        assertEquals("unknown", error.getSkillName());
        assertTrue(error.getMessage().contains("not found"));
    }

    @Test
    void shouldFailWithoutFrontmatter() throws Exception {
        writeSkill(tempDir, "plain", "Just markdown\n");

        assertThrows(SkillLoadException.class, () -> new FileSystemSkillLoader(List.of(tempDir)).load("plain"));
    }

    @Test
    void shouldRejectInvalidSkillName() {
        FileSystemSkillLoader loader = new FileSystemSkillLoader(List.of(tempDir));

        assertThrows(SkillLoadException.class, () -> loader.load("../etc"));
        assertThrows(SkillLoadException.class, () -> loader.load("Upper"));
    }

    @Test
    void shouldDiscoverAllParsableSkills() throws Exception {
        writeSkill(tempDir, "alpha", "---\nname: alpha\ndescription: a\n---\nA\n");
        writeSkill(tempDir, "nested/beta", "---\nname: beta\ndescription: b\n---\nB\n");
        writeSkill(tempDir, "broken", "no frontmatter\n");

        List<Skill> skills = new FileSystemSkillLoader(List.of(tempDir)).discover();

        assertEquals(List.of("alpha", "beta"), skills.stream().map(Skill::getName).sorted().toList());
    }
}
