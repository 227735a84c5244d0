package com.tony.fantasyGolf.model.dto;

/**
 * Résultat étiqueté par sa provenance. En cas d'erreur ou d'absence, {@code data} est null
 * et {@code reason} explique pourquoi.
 */
public record DataResult<T>(DataSource dataSource, T data, String reason) {

    public static <T> DataResult<T> of(DataSource source, T data) {
        return new DataResult<>(source, data, null);
    }

    public static <T> DataResult<T> none(String reason) {
        return new DataResult<>(DataSource.NONE, null, reason);
    }

    public static <T> DataResult<T> error(String reason) {
        return new DataResult<>(DataSource.ERROR, null, reason);
    }

    public boolean hasData() {
        return data != null;
    }
}
