package com.ryuqq.mirror.core.model;

/**
 * 데이터베이스 네임스페이스 ({@code database.collection}).
 *
 * <p>첫 번째 점(.) 앞이 database 이름이며, collection 이름에는 점이 포함될 수 있습니다
 * (예: {@code system.indexes}, {@code $cmd}).</p>
 *
 * @param database database 이름 (빈 문자열 불가)
 * @param collection collection 이름 (database 수준 네임스페이스는 빈 문자열)
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public record Namespace(String database, String collection) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException database가 null이거나 빈 문자열인 경우
     */
    public Namespace {
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("database cannot be null or blank");
        }
        if (collection == null) {
            collection = "";
        }
    }

    /**
     * 전체 네임스페이스 문자열 파싱.
     *
     * @param fullName 네임스페이스 (예: {@code test.foo})
     * @return Namespace 인스턴스
     * @throws IllegalArgumentException fullName이 null이거나 database 부분이 비어 있는 경우
     */
    public static Namespace parse(String fullName) {
        if (fullName == null) {
            throw new IllegalArgumentException("namespace cannot be null");
        }
        int dot = fullName.indexOf('.');
        if (dot < 0) {
            return new Namespace(fullName, "");
        }
        return new Namespace(fullName.substring(0, dot), fullName.substring(dot + 1));
    }

    /**
     * database 수준 명령 네임스페이스 ({@code db.$cmd}) 생성.
     *
     * @param database database 이름
     * @return 명령 네임스페이스
     */
    public static Namespace command(String database) {
        return new Namespace(database, "$cmd");
    }

    /**
     * 같은 database의 다른 collection 네임스페이스 생성.
     *
     * @param otherCollection collection 이름
     * @return 새 Namespace 인스턴스
     */
    public Namespace sibling(String otherCollection) {
        return new Namespace(database, otherCollection);
    }

    public boolean isCommand() {
        return "$cmd".equals(collection);
    }

    public String fullName() {
        return collection.isEmpty() ? database : database + "." + collection;
    }

    @Override
    public String toString() {
        return fullName();
    }
}
