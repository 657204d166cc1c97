package com.example.crazyeights.support;

import java.util.UUID;

import javax.sql.DataSource;

import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

import lombok.Getter;

/**
 * 每個測試一個獨立的 H2 記憶體資料庫 (MySQL 相容模式)，並套用正式的 schema.sql
 */
@Getter
public class H2TestDatabase {

	private final DataSource dataSource;
	private final JdbcTemplate jdbcTemplate;
	private final TransactionTemplate transactionTemplate;

	public H2TestDatabase() {
		DriverManagerDataSource ds = new DriverManagerDataSource();
		ds.setDriverClassName("org.h2.Driver");
		ds.setUrl("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
		ds.setUsername("sa");
		ds.setPassword("");
		new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(ds);

		this.dataSource = ds;
		this.jdbcTemplate = new JdbcTemplate(ds);
		this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(ds));
	}

	public int count(String table) {
		Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
		return count == null ? 0 : count;
	}
}
