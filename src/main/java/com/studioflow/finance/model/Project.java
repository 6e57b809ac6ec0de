package com.studioflow.finance.model;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "projects")
@Data
public class Project {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(unique = true)
    private String code; // e.g. "100-NVRT", printed on receipts

    @ManyToOne
    @JoinColumn(name = "client_id", nullable = false)
    private Client client;
}
