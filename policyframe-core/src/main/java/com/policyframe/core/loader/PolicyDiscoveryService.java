package com.policyframe.core.loader;

import com.policyframe.api.exception.PolicyDefinitionException;
import com.policyframe.api.policy.Policies;
import com.policyframe.api.policy.Policy;
import com.policyframe.core.config.PolicyFrameConfig;
import com.policyframe.core.manager.PolicyManager;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * 策略自动发现服务
 * <p>
 * 职责：
 * 1. 扫描 policyHome 目录下的 yml 清单 (按文件名排序，保证加载顺序稳定)
 * 2. 实例化清单声明的策略类
 * 3. 逐个交给 PolicyManager 注册
 * <p>
 * 任何一个清单出错都会中止加载，已注册的策略保留。
 */
@Slf4j
public class PolicyDiscoveryService implements PolicySource {

    private final PolicyFrameConfig config;
    private final ClassLoader classLoader;

    public PolicyDiscoveryService(PolicyFrameConfig config) {
        this(config, defaultClassLoader());
    }

    public PolicyDiscoveryService(PolicyFrameConfig config, ClassLoader classLoader) {
        this.config = config;
        this.classLoader = classLoader;
    }

    /**
     * 执行扫描并注册
     * <p>
     * 逐个清单构建并注册，某个清单出错时中止，之前的策略保留在注册表中。
     */
    public void scanAndLoad(PolicyManager policyManager) {
        if (!config.isAutoScan()) {
            log.info("AutoScan is disabled, skipping policy discovery");
            return;
        }
        if (!config.hasPolicyHome()) {
            log.info("No policyHome configured, skipping policy discovery");
            return;
        }
        int loaded = 0;
        for (File file : listManifests()) {
            Entry entry = toEntry(file);
            policyManager.register(entry.getName(), entry.getPolicy());
            loaded++;
        }
        log.info("Policy discovery finished. Loaded: {}, total registered: {}",
                loaded, policyManager.getPolicyNames().size());
    }

    @Override
    public List<Entry> load() {
        List<Entry> entries = new ArrayList<>();
        for (File file : listManifests()) {
            entries.add(toEntry(file));
        }
        return entries;
    }

    private List<File> listManifests() {
        File home = new File(config.getPolicyHome());
        File[] files = home.listFiles();
        if (!home.isDirectory() || files == null) {
            throw new PolicyDefinitionException(home.getAbsolutePath(),
                    "Policy directory is not readable: " + home.getAbsolutePath());
        }

        Arrays.sort(files, Comparator.comparing(File::getName));
        log.info("Starting policy discovery from {}, count: {}", home.getAbsolutePath(), files.length);

        List<File> manifests = new ArrayList<>();
        for (File file : files) {
            if (PolicyManifestLoader.isManifest(file)) {
                manifests.add(file);
            } else {
                log.debug("Skipping non-manifest file: {}", file.getName());
            }
        }
        return manifests;
    }

    private Entry toEntry(File file) {
        PolicyManifest manifest = PolicyManifestLoader.parse(file);
        if (manifest.getDescription() != null) {
            log.info("Discovered policy {} -> {} ({})", manifest.getName(), manifest.getClassName(), manifest.getDescription());
        } else {
            log.info("Discovered policy {} -> {}", manifest.getName(), manifest.getClassName());
        }
        return new Entry(manifest.getName(), instantiate(manifest, file));
    }

    private Policy instantiate(PolicyManifest manifest, File file) {
        String source = file.getAbsolutePath();
        Class<?> type;
        try {
            type = Class.forName(manifest.getClassName(), true, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new PolicyDefinitionException(source, "Policy class not found: " + manifest.getClassName(), e);
        }
        if (!Policy.class.isAssignableFrom(type)) {
            throw new PolicyDefinitionException(source,
                    "Class " + manifest.getClassName() + " does not implement " + Policy.class.getName());
        }

        Policy policy;
        try {
            policy = (Policy) type.getDeclaredConstructor().newInstance();
        } catch (InvocationTargetException e) {
            throw new PolicyDefinitionException(source, "Policy constructor failed: " + manifest.getClassName(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new PolicyDefinitionException(source,
                    "Policy class needs a public no-arg constructor: " + manifest.getClassName(), e);
        }

        // 清单中的声明优先于类自身的声明
        if (manifest.isApplyPointDeclared()) {
            return Policies.at(manifest.getApplyPoint(), policy);
        }
        return policy;
    }

    private static ClassLoader defaultClassLoader() {
        ClassLoader contextLoader = Thread.currentThread().getContextClassLoader();
        return contextLoader != null ? contextLoader : PolicyDiscoveryService.class.getClassLoader();
    }
}
