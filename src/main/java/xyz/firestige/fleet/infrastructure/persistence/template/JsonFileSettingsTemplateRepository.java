package xyz.firestige.fleet.infrastructure.persistence.template;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.fleet.domain.template.SettingsTemplate;
import xyz.firestige.fleet.domain.template.SettingsTemplateRepository;
import xyz.firestige.fleet.exception.TemplateStoreException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 本地 JSON 文件模板仓储
 * <p>
 * 启动时整体载入，每次保存 / 删除后整体重写（先写临时文件再替换）。
 * 名称比较忽略大小写。
 */
public class JsonFileSettingsTemplateRepository implements SettingsTemplateRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSettingsTemplateRepository.class);

    private static final TypeReference<List<SettingsTemplate>> LIST_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Map<String, SettingsTemplate> templates = new LinkedHashMap<>();

    public JsonFileSettingsTemplateRepository(Path file) {
        this.file = file;
        load();
    }

    private synchronized void load() {
        if (!Files.exists(file)) {
            log.info("[TemplateRepository] 模板文件不存在，使用空列表: {}", file);
            return;
        }
        try {
            List<SettingsTemplate> loaded = mapper.readValue(file.toFile(), LIST_TYPE);
            for (SettingsTemplate template : loaded) {
                templates.put(key(template.getName()), template);
            }
            log.info("[TemplateRepository] 已载入 {} 个模板: {}", templates.size(), file);
        } catch (IOException e) {
            throw new TemplateStoreException("模板文件读取失败: " + file, e);
        }
    }

    @Override
    public synchronized void save(SettingsTemplate template) {
        templates.put(key(template.getName()), template);
        persist();
        log.info("[TemplateRepository] 模板已保存: {}", template.getName());
    }

    @Override
    public synchronized boolean delete(String name) {
        if (templates.remove(key(name)) == null) {
            return false;
        }
        persist();
        log.info("[TemplateRepository] 模板已删除: {}", name);
        return true;
    }

    @Override
    public synchronized Optional<SettingsTemplate> find(String name) {
        return Optional.ofNullable(templates.get(key(name)));
    }

    @Override
    public synchronized List<SettingsTemplate> findAll() {
        return List.copyOf(templates.values());
    }

    private void persist() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), new ArrayList<>(templates.values()));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new TemplateStoreException("模板文件写入失败: " + file, e);
        }
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    public Path getFile() {
        return file;
    }
}
