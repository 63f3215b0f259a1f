package io.github.yok.ssmmigrator.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.ssmmigrator.config.AwsConfig;
import io.github.yok.ssmmigrator.exception.ConfigLoadException;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.regions.Region;

class SsmParameterStoreFactoryTest {

    private AwsConfig awsConfig;
    private SsmParameterStoreFactory factory;

    @BeforeEach
    void setup() {
        awsConfig = new AwsConfig();
        awsConfig.setRegion("ap-northeast-1");
        factory = new SsmParameterStoreFactory(awsConfig);
    }

    @Test
    void create_異常ケース_存在しないプロファイル_ConfigLoadExceptionが送出されること() {
        String profile = "no-such-profile-" + UUID.randomUUID();

        ConfigLoadException ex =
                assertThrows(ConfigLoadException.class, () -> factory.create(profile));

        assertEquals(ConfigLoadException.OPERATION, ex.getOperation());
        assertTrue(ex.getMessage().contains(profile));
    }

    @Test
    void resolveRegion_正常ケース_リージョン指定あり_指定値が使われること() {
        awsConfig.setRegion(" us-west-2 ");

        assertEquals(Region.US_WEST_2, factory.resolveRegion("any"));
    }
}
