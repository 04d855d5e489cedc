package com.legalreview.extraction.repository;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import(JpaReviewStore.class)
class JpaReviewStoreTest extends ReviewStoreContract {

    @Autowired
    private JpaReviewStore store;

    @Override
    protected ReviewStore store() {
        return store;
    }
}
