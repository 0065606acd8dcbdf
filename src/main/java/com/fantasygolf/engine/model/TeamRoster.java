package com.fantasygolf.engine.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "team_rosters", indexes = {
    @Index(name = "idx_roster_user", columnList = "user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamRoster {
    @Id
    @Column(name = "roster_id")
    private String rosterId;
    
    @Column(name = "user_id", nullable = false)
    private String userId;
    
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "team_roster_golfers", joinColumns = @JoinColumn(name = "roster_id"))
    @Column(name = "golfer_id")
    @Builder.Default
    private List<String> golferIds = new ArrayList<>();
}
