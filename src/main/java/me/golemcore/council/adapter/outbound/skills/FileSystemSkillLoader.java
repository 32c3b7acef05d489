package me.golemcore.council.adapter.outbound.skills;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.domain.exception.SkillLoadException;
import me.golemcore.council.domain.model.Skill;
import me.golemcore.council.port.outbound.SkillLoader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Loads skills from {@code SKILL.md} files kept in a folder named after the
 * skill, anywhere below the configured directories. Directories are searched
 * in the configured order and earlier ones shadow later ones.
 *
 * <p>
 * A skill file starts with YAML frontmatter between {@code ---} lines followed
 * by the markdown instructions. The skill name comes from the frontmatter, or
 * from the enclosing directory when the frontmatter omits it.
 */
@Slf4j
public class FileSystemSkillLoader implements SkillLoader {

    static final String SKILL_FILE = "SKILL.md";

    private static final Pattern FRONTMATTER_PATTERN = Pattern.compile(
            "^---\\s*\\n(.*?)\\n---\\s*\\n(.*)$", Pattern.DOTALL);
    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z0-9]+(-[a-z0-9]+)*$");

    private final List<Path> directories;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public FileSystemSkillLoader(List<Path> directories) {
        this.directories = List.copyOf(directories);
    }

    @Override
    public Skill load(String name) throws SkillLoadException {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new SkillLoadException(name, "Invalid skill name: '" + name + "'");
        }
        for (Path directory : directories) {
            Optional<Path> file = find(directory, name);
            if (file.isPresent()) {
                Skill skill = parse(name, file.get());
                log.debug("[Skills] Loaded '{}' from {}", name, file.get());
                return skill;
            }
        }
        throw new SkillLoadException(name,
                "Skill '" + name + "' not found in " + directories);
    }

    /**
     * Lists every skill available across the configured directories. A name
     * found in more than one directory resolves to the first one. Files that
     * fail to parse are skipped.
     */
    public List<Skill> discover() {
        Map<String, Skill> found = new LinkedHashMap<>();
        for (Path directory : directories) {
            for (Path file : listSkillFiles(directory)) {
                String name = file.getParent().getFileName().toString();
                if (found.containsKey(name)) {
                    continue;
                }
                try {
                    found.put(name, parse(name, file));
                } catch (SkillLoadException e) {
                    log.warn("[Skills] Skipping {}: {}", file, e.getMessage());
                }
            }
        }
        return new ArrayList<>(found.values());
    }

    private Optional<Path> find(Path directory, String name) throws SkillLoadException {
        if (!Files.isDirectory(directory)) {
            return Optional.empty();
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            return paths
                    .filter(p -> p.getFileName().toString().equals(SKILL_FILE))
                    .filter(p -> p.getParent() != null && p.getParent().getFileName().toString().equals(name))
                    .min(Comparator.comparingInt(Path::getNameCount));
        } catch (IOException | UncheckedIOException e) {
            throw new SkillLoadException(name, "Failed to search " + directory, e);
        }
    }

    private List<Path> listSkillFiles(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            return paths
                    .filter(p -> p.getFileName().toString().equals(SKILL_FILE))
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            log.warn("[Skills] Failed to scan {}: {}", directory, e.getMessage());
            return List.of();
        }
    }

    @SuppressWarnings("unchecked")
    Skill parse(String name, Path file) throws SkillLoadException {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SkillLoadException(name, "Failed to read " + file, e);
        }

        Matcher matcher = FRONTMATTER_PATTERN.matcher(content);
        if (!matcher.matches()) {
            throw new SkillLoadException(name, "Missing frontmatter in " + file);
        }

        Map<String, Object> frontmatter;
        try {
            frontmatter = yamlMapper.readValue(matcher.group(1), Map.class);
        } catch (IOException e) {
            throw new SkillLoadException(name, "Invalid frontmatter in " + file, e);
        }
        if (frontmatter == null) {
            frontmatter = Map.of();
        }

        String skillName = frontmatter.get("name") instanceof String s && !s.isBlank() ? s : name;
        String description = frontmatter.get("description") instanceof String d ? d : "";

        return Skill.builder()
                .name(skillName)
                .description(description)
                .instructions(matcher.group(2).trim())
                .frontmatter(frontmatter)
                .location(file)
                .build();
    }
}
