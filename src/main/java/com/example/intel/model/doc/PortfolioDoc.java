package com.example.intel.model.doc;

import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Document(collection = "portfolios")
public class PortfolioDoc {
    @Id
    private String id;           // uuid
    @Indexed
    private String name;
    private Instant createdAt;
    private List<HoldingDoc> holdings = new ArrayList<>();
}
