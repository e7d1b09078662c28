package com.policyframe.core.loader;

import com.policyframe.api.exception.PolicyDefinitionException;
import com.policyframe.api.policy.Policy;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.Map;

@Slf4j
public class PolicyManifestLoader {

    private static final String KEY_CLASS = "class";
    private static final String KEY_APPLY_POINT = "applyPoint";
    private static final String KEY_DESCRIPTION = "description";

    /**
     * 是否为清单文件
     */
    public static boolean isManifest(File file) {
        String fileName = file.getName();
        return file.isFile() && (fileName.endsWith(".yml") || fileName.endsWith(".yaml"));
    }

    /**
     * 策略名：去掉扩展名的文件名
     */
    public static String policyName(File file) {
        String fileName = file.getName();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * 解析清单
     *
     * @throws PolicyDefinitionException 文件无法读取或内容不合法
     */
    public static PolicyManifest parse(File file) {
        String source = file.getAbsolutePath();
        Object document;
        try (InputStream is = Files.newInputStream(file.toPath())) {
            document = createYaml().load(is);
        } catch (IOException | YAMLException e) {
            throw new PolicyDefinitionException(source, "Failed to read policy manifest: " + source, e);
        }

        if (!(document instanceof Map<?, ?> root)) {
            throw new PolicyDefinitionException(source, "Policy manifest must be a mapping: " + source);
        }

        Object className = root.get(KEY_CLASS);
        if (!(className instanceof String) || ((String) className).trim().isEmpty()) {
            throw new PolicyDefinitionException(source, "Policy manifest has no '" + KEY_CLASS + "': " + source);
        }

        PolicyManifest manifest = new PolicyManifest();
        manifest.setName(policyName(file));
        manifest.setClassName(((String) className).trim());
        if (root.containsKey(KEY_APPLY_POINT)) {
            manifest.setApplyPointDeclared(true);
            manifest.setApplyPoint(toApplyPointAttribute(root.get(KEY_APPLY_POINT)));
        }
        Object description = root.get(KEY_DESCRIPTION);
        if (description != null) {
            manifest.setDescription(description.toString());
        }
        return manifest;
    }

    /**
     * 显式声明的假值 (false、~、空串) 表示保留名称不绑定
     */
    private static String toApplyPointAttribute(Object value) {
        if (value == null || Boolean.FALSE.equals(value) || value.toString().trim().isEmpty()) {
            return Policy.DISABLED;
        }
        return value.toString().trim();
    }

    private static Yaml createYaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }
}
