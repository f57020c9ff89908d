package com.yamdb.backend.modules.catalog.infrastructure.persistence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.yamdb.backend.modules.catalog.domain.Title;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

@Repository
public class TitleRepositoryImpl implements TitleRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    /**
     * Pages title ids with native SQL, then fetches the page with category and genres in one query.
     */
    @Override
    public Page<Title> search(TitleSearchCondition condition, Pageable pageable) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(pageable, "pageable must not be null");

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        if (StringUtils.hasText(condition.categorySlug())) {
            whereClauses.add("lower(c.slug) like :categorySlug");
            params.put("categorySlug", containsPattern(condition.categorySlug()));
        }
        if (StringUtils.hasText(condition.genreSlug())) {
            whereClauses.add("""
                    exists (select 1 from title_genre tg
                              join genre g on g.id = tg.genre_id
                             where tg.title_id = t.id and lower(g.slug) like :genreSlug)""");
            params.put("genreSlug", containsPattern(condition.genreSlug()));
        }
        if (StringUtils.hasText(condition.name())) {
            whereClauses.add("lower(t.name) like :name");
            params.put("name", containsPattern(condition.name()));
        }
        if (condition.year() != null) {
            whereClauses.add("t.release_year = :year");
            params.put("year", condition.year());
        }

        String baseJoin = " FROM title t LEFT JOIN category c ON c.id = t.category_id ";
        String whereSql = whereClauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", whereClauses);

        Query countQuery = entityManager.createNativeQuery("SELECT COUNT(*)" + baseJoin + whereSql);
        params.forEach(countQuery::setParameter);
        Number total = (Number) countQuery.getSingleResult();

        String dataSql = "SELECT t.id" + baseJoin + whereSql + " ORDER BY t.name, t.id LIMIT :limit OFFSET :offset";
        Query dataQuery = entityManager.createNativeQuery(dataSql);
        params.forEach(dataQuery::setParameter);
        dataQuery.setParameter("limit", pageable.getPageSize());
        dataQuery.setParameter("offset", pageable.getOffset());

        @SuppressWarnings("unchecked")
        List<Object> rawIds = dataQuery.getResultList();
        List<UUID> ids = rawIds.stream()
                .map(value -> value instanceof UUID uuid ? uuid : UUID.fromString(value.toString()))
                .toList();

        if (ids.isEmpty()) {
            return new PageImpl<>(List.of(), pageable, total.longValue());
        }

        List<Title> titles = entityManager.createQuery("""
                        select distinct t
                          from Title t
                          left join fetch t.category
                          left join fetch t.genres
                         where t.id in :ids
                        """, Title.class)
                .setParameter("ids", ids)
                .getResultList();

        Map<UUID, Integer> index = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            index.put(ids.get(i), i);
        }
        List<Title> ordered = new ArrayList<>(titles);
        ordered.sort((a, b) -> Integer.compare(index.getOrDefault(a.getId(), Integer.MAX_VALUE),
                index.getOrDefault(b.getId(), Integer.MAX_VALUE)));
        return new PageImpl<>(ordered, pageable, total.longValue());
    }

    private static String containsPattern(String value) {
        String escaped = value.trim().toLowerCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }
}
