package io.github.yok.ssmmigrator.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.ssmmigrator.config.Environment;
import io.github.yok.ssmmigrator.config.MigrationConfig;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class NameMapperTest {

    private MigrationConfig config;
    private NameMapper mapper;

    @BeforeEach
    void setup() {
        config = new MigrationConfig();
        config.setVariables(List.of("REDISCLOUD_URL", "MYSQL_HOST", "DD_API_KEY"));
        mapper = new NameMapper(config);
    }

    @Test
    void map_正常ケース_既定の階層で生成する_旧名と新名が期待形式であること() {
        NameMapping mapping = mapper.map(Environment.STAGING);

        assertEquals(3, mapping.size());
        NamePair first = mapping.getPairs().get(0);
        assertEquals("/asset-accounting/staging/REDISCLOUD_URL", first.getOldName());
        assertEquals("/asset-accounting/serviceplatform/staging/REDISCLOUD_URL",
                first.getNewName());
    }

    @ParameterizedTest
    @EnumSource(Environment.class)
    void map_正常ケース_全環境で生成する_変数ごとに1件で接頭辞のみが置換されること(Environment environment) {
        NameMapping mapping = mapper.map(environment);

        assertEquals(config.getVariables().size(), mapping.size());
        assertEquals(environment, mapping.getEnvironment());
        String oldPrefix = "/asset-accounting/" + environment.getLabel() + "/";
        String newPrefix = "/asset-accounting/serviceplatform/" + environment.getLabel() + "/";
        for (NamePair pair : mapping) {
            assertTrue(pair.getOldName().startsWith(oldPrefix), pair.getOldName());
            String variable = pair.getOldName().substring(oldPrefix.length());
            assertEquals(newPrefix + variable, pair.getNewName());
            assertTrue(config.getVariables().contains(variable));
        }
    }

    @Test
    void map_正常ケース_同じ環境で2回生成する_同一のマッピングであること() {
        NameMapping first = mapper.map(Environment.PRODUCTION);
        NameMapping second = mapper.map(Environment.PRODUCTION);

        assertNotSame(first, second);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void map_正常ケース_変数の順序を保持する_設定順で列挙されること() {
        List<String> oldNames = mapper.map(Environment.BETA).getPairs().stream()
                .map(NamePair::getOldName).collect(Collectors.toList());

        assertEquals(List.of("/asset-accounting/beta/REDISCLOUD_URL",
                "/asset-accounting/beta/MYSQL_HOST", "/asset-accounting/beta/DD_API_KEY"),
                oldNames);
    }

    @Test
    void map_正常ケース_名前空間とサブシステムを変更する_変更後の値で生成されること() {
        config.setNamespace("ns");
        config.setSubsystem("sp");
        config.setVariables(List.of("REDISCLOUD_URL"));

        NamePair pair = mapper.map(Environment.STAGING).getPairs().get(0);

        assertEquals("/ns/staging/REDISCLOUD_URL", pair.getOldName());
        assertEquals("/ns/sp/staging/REDISCLOUD_URL", pair.getNewName());
    }

    @Test
    void map_正常ケース_変数が空_空のマッピングが返ること() {
        config.setVariables(List.of());

        assertEquals(0, mapper.map(Environment.STAGING).size());
    }

    @Test
    void map_異常ケース_環境にnullを指定する_NullPointerExceptionが送出されること() {
        assertThrows(NullPointerException.class, () -> mapper.map(null));
    }

    @Test
    void oldPrefix_正常ケース_接頭辞を取得する_スラッシュで終わること() {
        assertEquals("/asset-accounting/production/", mapper.oldPrefix(Environment.PRODUCTION));
        assertEquals("/asset-accounting/serviceplatform/production/",
                mapper.newPrefix(Environment.PRODUCTION));
    }
}
