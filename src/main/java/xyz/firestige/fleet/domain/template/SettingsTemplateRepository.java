package xyz.firestige.fleet.domain.template;

import java.util.List;
import java.util.Optional;

/**
 * 活动参数模板仓储
 */
public interface SettingsTemplateRepository {

    /**
     * 新增或按名称覆盖
     */
    void save(SettingsTemplate template);

    boolean delete(String name);

    Optional<SettingsTemplate> find(String name);

    /**
     * 按保存顺序返回
     */
    List<SettingsTemplate> findAll();
}
