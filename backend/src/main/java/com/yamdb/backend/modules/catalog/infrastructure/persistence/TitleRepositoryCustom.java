package com.yamdb.backend.modules.catalog.infrastructure.persistence;

import com.yamdb.backend.modules.catalog.domain.Title;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface TitleRepositoryCustom {

    Page<Title> search(TitleSearchCondition condition, Pageable pageable);
}
