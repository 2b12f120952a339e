package com.confectionery.distribution.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Goods handed back by a manager to the central pool.
 */
@Entity
@Table(name = "manager_returns")
@Data
public class ManagerReturn {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "manager_id", nullable = false)
    private User manager;

    // true when the goods came out of the manager's return bin
    @Column(nullable = false)
    private boolean fromReturnBin = true;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @OneToMany(mappedBy = "managerReturn", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<ManagerReturnItem> items = new ArrayList<>();

    @PrePersist
    protected void onCreate() {
        if (createdAt == null)
            createdAt = LocalDateTime.now();
    }

    public void addItem(ManagerReturnItem item) {
        item.setManagerReturn(this);
        items.add(item);
    }
}
