/*
 * Copyright (c) 2014-2022 Dell Inc. or its subsidiaries. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.emc.ecs.bulkimport.service;

import com.emc.ecs.bulkimport.config.ImportOptions;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.crypto.Cipher;
import javax.crypto.spec.SecretKeySpec;
import javax.xml.bind.DatatypeConverter;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.MessageDigest;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Date;

public class MySQLIndexService extends AbstractIndexService {
    private static final Logger log = LoggerFactory.getLogger(MySQLIndexService.class);

    private static Key cipherKey;

    private final String connectString;
    private final String username;
    private String password;

    static {
        try {
            cipherKey = new SecretKeySpec(MessageDigest.getInstance("MD5")
                    .digest(ImportOptions.DB_DESC.getBytes(StandardCharsets.UTF_8)), "AES");
        } catch (GeneralSecurityException e) {
            log.warn("unable to create password cipher key: " + e, e);
        }
    }

    public static void main(String[] args) {
        if (args.length < 1 || !"encrypt-password".equals(args[0])) {
            printHelp();
            System.exit(1);
        }
        String password = new String(System.console().readPassword("Password to encrypt: "));
        System.out.println("Encrypted password: " + encryptPassword(password));
    }

    public static void printHelp() {
        System.out.println("usage: java -cp bulk-import-{version}.jar " + MySQLIndexService.class.getName() + " encrypt-password");
    }

    public static String encryptPassword(String password) {
        try {
            Cipher encryptCipher = Cipher.getInstance("AES");
            encryptCipher.init(Cipher.ENCRYPT_MODE, cipherKey);
            return DatatypeConverter.printBase64Binary(encryptCipher.doFinal(password.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new RuntimeException("unable to encrypt password: " + e, e);
        }
    }

    static String decryptPassword(String encPassword) {
        try {
            Cipher decryptCipher = Cipher.getInstance("AES");
            decryptCipher.init(Cipher.DECRYPT_MODE, cipherKey);
            return new String(decryptCipher.doFinal(DatatypeConverter.parseBase64Binary(encPassword)), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new RuntimeException("unable to decrypt password: " + e, e);
        }
    }

    public MySQLIndexService(String connectString, String username, String password, String encPassword) {
        this.connectString = connectString;
        this.username = username;
        this.password = password;
        if (encPassword != null) {
            this.password = decryptPassword(encPassword);
        }
    }

    @Override
    public void deleteDatabase() {
        JdbcTemplate template = createJdbcTemplate();
        try {
            template.execute("drop table if exists " + getTableName());
        } finally {
            close(template);
        }
    }

    @Override
    public synchronized void close() {
        try {
            if (isInitialized()) close(getJdbcTemplate());
        } finally {
            super.close();
        }
    }

    protected void close(JdbcTemplate template) {
        try {
            ((HikariDataSource) template.getDataSource()).close();
        } catch (RuntimeException e) {
            log.warn("could not close data source", e);
        }
    }

    @Override
    protected JdbcTemplate createJdbcTemplate() {
        HikariDataSource ds = new HikariDataSource();
        ds.setJdbcUrl(connectString);
        if (username != null) ds.setUsername(username);
        if (password != null) ds.setPassword(password);
        ds.setMaximumPoolSize(ImportOptions.MAX_THREAD_COUNT);
        ds.setMinimumIdle(2);
        ds.addDataSourceProperty("characterEncoding", "utf8");
        ds.addDataSourceProperty("cachePrepStmts", "true");
        ds.addDataSourceProperty("prepStmtCacheSize", "256");
        ds.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");
        return new JdbcTemplate(ds);
    }

    @Override
    protected void createTable() {
        try {
            getJdbcTemplate().update("CREATE TABLE IF NOT EXISTS " + getTableName() + " (" +
                    "file_id VARCHAR(128) PRIMARY KEY NOT NULL," +
                    "source_path VARCHAR(750) NOT NULL," +
                    "group_name VARCHAR(16) NOT NULL," +
                    "store_path_index INT NOT NULL," +
                    "full_path VARCHAR(1024) NOT NULL," +
                    "size BIGINT NOT NULL," +
                    "crc32 BIGINT NULL," +
                    "create_time DATETIME NULL," +
                    "modify_time DATETIME NULL," +
                    "import_time DATETIME NOT NULL," +
                    "ext_name VARCHAR(8) NULL," +
                    "import_mode VARCHAR(8) NOT NULL," +
                    "INDEX source_idx (source_path)" +
                    ") ENGINE=InnoDB ROW_FORMAT=COMPRESSED");
        } catch (RuntimeException e) {
            log.error("could not create DB table {}. note: name may only contain alphanumeric or underscore", getTableName());
            throw e;
        }
    }

    @Override
    public Date getResultDate(ResultSet rs, String name) throws SQLException {
        return new Date(rs.getTimestamp(name).getTime());
    }

    @Override
    public Object getDateParam(Date date) {
        if (date == null) return null;
        return new java.sql.Timestamp(date.getTime());
    }
}
