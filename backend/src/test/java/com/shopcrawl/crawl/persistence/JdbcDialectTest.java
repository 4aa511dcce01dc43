package com.shopcrawl.crawl.persistence;

import com.shopcrawl.crawl.support.TestClockConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class JdbcDialectTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void dialectBeanIsBuiltFromTheDataSource() {
        JdbcDialect dialect = context.getBean(JdbcDialect.class);

        assertThat(dialect.isPostgres()).isFalse();
        assertThat(context.getBean(VisitedUrlRepository.class)).isNotNull();
        assertThat(context.getBean(CrawlResultRepository.class)).isNotNull();
    }
}
